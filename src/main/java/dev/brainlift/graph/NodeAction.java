package dev.brainlift.graph;

/**
 * The work performed by a graph node. Receives the state as of the moment the node started.
 *
 * @param <S> immutable state type
 */
@FunctionalInterface
public interface NodeAction<S> {

  StateUpdate<S> execute(S state) throws Exception;
}

package dev.brainlift.graph;

/**
 * A change to the workflow state produced by a node. Updates are applied atomically against the
 * latest state, so concurrently finishing branches never overwrite each other.
 *
 * @param <S> immutable state type
 */
@FunctionalInterface
public interface StateUpdate<S> {

  S applyTo(S state);

  static <S> StateUpdate<S> none() {
    return state -> state;
  }
}

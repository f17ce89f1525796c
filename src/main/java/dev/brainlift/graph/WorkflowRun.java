package dev.brainlift.graph;

import dev.brainlift.graph.WorkflowGraph.NodeDefinition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One execution of a {@link CompiledWorkflow}.
 *
 * <p>Scheduling bookkeeping is guarded by the run's monitor. The state lives in an {@link
 * AtomicReference} and every node's {@link StateUpdate} is applied with {@code updateAndGet}, so
 * parallel branches merge without lost updates.
 *
 * @param <S> immutable state type
 */
public final class WorkflowRun<S> {

  private static final Logger log = LoggerFactory.getLogger(WorkflowRun.class);

  private final Map<String, NodeDefinition<S>> nodes;
  private final Map<String, List<String>> successors;
  private final Map<String, Integer> remainingPredecessors;
  private final ExecutorService executor;
  private final AtomicReference<S> state;
  private final CompletableFuture<S> completion = new CompletableFuture<>();
  private final Map<String, Future<?>> running = new HashMap<>();
  private final Set<String> skipped = new LinkedHashSet<>();
  private int outstanding;
  private boolean aborted;

  WorkflowRun(
      Map<String, NodeDefinition<S>> nodes,
      Map<String, List<String>> successors,
      Map<String, Integer> predecessorCounts,
      S initialState,
      ExecutorService executor) {
    this.nodes = nodes;
    this.successors = successors;
    this.remainingPredecessors = new HashMap<>(predecessorCounts);
    this.executor = executor;
    this.state = new AtomicReference<>(initialState);
    this.outstanding = nodes.size();
  }

  /** Completes with the final state once every node has finished or been skipped. */
  public CompletableFuture<S> completion() {
    return completion;
  }

  public S currentState() {
    return state.get();
  }

  /** Names of join nodes whose gate was closed when they became ready. */
  public synchronized Set<String> skippedNodes() {
    return Set.copyOf(skipped);
  }

  /** Stop scheduling nodes and interrupt the ones in flight. */
  public void cancel() {
    List<Future<?>> inFlight;
    synchronized (this) {
      if (aborted) {
        return;
      }
      aborted = true;
      inFlight = new ArrayList<>(running.values());
      running.clear();
    }
    inFlight.forEach(future -> future.cancel(true));
    completion.cancel(false);
  }

  synchronized void begin() {
    for (String entry : successors.getOrDefault(WorkflowGraph.START, List.of())) {
      if (remainingPredecessors.get(entry) == 0) {
        becomeReady(entry);
      }
    }
    completeIfDone();
  }

  private void becomeReady(String name) {
    NodeDefinition<S> node = nodes.get(name);
    if (node.isJoin() && !node.gate().test(state.get())) {
      log.debug("Join '{}' gate closed; skipping", name);
      skipped.add(name);
      finished(name);
      return;
    }
    try {
      running.put(name, executor.submit(() -> runNode(node)));
    } catch (RejectedExecutionException e) {
      abort(name, e);
    }
  }

  private void runNode(NodeDefinition<S> node) {
    StateUpdate<S> update;
    try {
      log.debug("Workflow node '{}' started", node.name());
      update = node.action().execute(state.get());
    } catch (Exception e) {
      synchronized (this) {
        abort(node.name(), e);
      }
      return;
    }
    synchronized (this) {
      if (aborted) {
        return;
      }
      running.remove(node.name());
      state.updateAndGet(update::applyTo);
      log.debug("Workflow node '{}' finished", node.name());
      finished(node.name());
      completeIfDone();
    }
  }

  private void finished(String name) {
    outstanding--;
    for (String next : successors.getOrDefault(name, List.of())) {
      if (remainingPredecessors.merge(next, -1, Integer::sum) == 0) {
        becomeReady(next);
      }
    }
  }

  private void completeIfDone() {
    if (!aborted && outstanding == 0) {
      completion.complete(state.get());
    }
  }

  private void abort(String nodeName, Throwable cause) {
    if (aborted) {
      return;
    }
    aborted = true;
    running.remove(nodeName);
    running.values().forEach(future -> future.cancel(true));
    running.clear();
    completion.completeExceptionally(new WorkflowException(nodeName, cause));
  }
}

package dev.brainlift.graph;

import dev.brainlift.graph.WorkflowGraph.NodeDefinition;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * An immutable, validated workflow. Each call to {@link #start} creates an independent run.
 *
 * @param <S> immutable state type
 */
public final class CompiledWorkflow<S> {

  private final Map<String, NodeDefinition<S>> nodes;
  private final Map<String, List<String>> successors;
  private final Map<String, Integer> predecessorCounts;

  CompiledWorkflow(
      Map<String, NodeDefinition<S>> nodes,
      Map<String, List<String>> successors,
      Map<String, Integer> predecessorCounts) {
    this.nodes = Map.copyOf(nodes);
    this.successors = Map.copyOf(successors);
    this.predecessorCounts = Map.copyOf(predecessorCounts);
  }

  public Set<String> nodeNames() {
    return nodes.keySet();
  }

  public List<String> successorsOf(String nodeName) {
    return successors.getOrDefault(nodeName, List.of());
  }

  /**
   * Start a run on the given executor. Nodes are submitted to the executor as soon as they become
   * ready.
   */
  public WorkflowRun<S> start(S initialState, ExecutorService executor) {
    WorkflowRun<S> run =
        new WorkflowRun<>(nodes, successors, predecessorCounts, initialState, executor);
    run.begin();
    return run;
  }
}

package dev.brainlift.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Builder for a directed acyclic workflow of named nodes.
 *
 * <p>A node runs once all of its predecessors have finished. A join node additionally carries a
 * gate predicate evaluated against the state at that moment; when the gate is closed the join is
 * skipped. Nodes with no dependency between them run in parallel.
 *
 * <pre>{@code
 * CompiledWorkflow<MyState> workflow = new WorkflowGraph<MyState>()
 *     .addNode("plan", planAction)
 *     .addNode("left", leftAction)
 *     .addNode("right", rightAction)
 *     .addJoin("merge", MyState::bothDone, mergeAction)
 *     .addEdge(WorkflowGraph.START, "plan")
 *     .addEdge("plan", "left").addEdge("plan", "right")
 *     .addEdge("left", "merge").addEdge("right", "merge")
 *     .compile();
 * }</pre>
 *
 * @param <S> immutable state type
 */
public final class WorkflowGraph<S> {

  public static final String START = "__start__";
  public static final String END = "__end__";

  private final Map<String, NodeDefinition<S>> nodes = new LinkedHashMap<>();
  private final Map<String, Set<String>> edges = new LinkedHashMap<>();

  public WorkflowGraph<S> addNode(String name, NodeAction<S> action) {
    return register(new NodeDefinition<>(name, action, null));
  }

  public WorkflowGraph<S> addJoin(String name, Predicate<S> gate, NodeAction<S> action) {
    return register(new NodeDefinition<>(name, action, gate));
  }

  public WorkflowGraph<S> addEdge(String from, String to) {
    if (from.equals(END)) {
      throw new IllegalArgumentException("END has no outgoing edges");
    }
    if (to.equals(START)) {
      throw new IllegalArgumentException("START has no incoming edges");
    }
    edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    return this;
  }

  /**
   * Validate the graph and freeze it.
   *
   * @throws IllegalStateException if an edge references an unknown node, a node is unreachable
   *     from {@link #START}, or the graph contains a cycle
   */
  public CompiledWorkflow<S> compile() {
    if (!edges.containsKey(START)) {
      throw new IllegalStateException("Workflow has no entry edge from START");
    }
    Map<String, List<String>> successors = new LinkedHashMap<>();
    Map<String, Integer> predecessorCounts = new HashMap<>();
    nodes.keySet().forEach(name -> predecessorCounts.put(name, 0));

    edges.forEach(
        (from, targets) -> {
          if (!from.equals(START) && !nodes.containsKey(from)) {
            throw new IllegalStateException("Edge from unknown node '" + from + "'");
          }
          for (String to : targets) {
            if (to.equals(END)) {
              continue;
            }
            if (!nodes.containsKey(to)) {
              throw new IllegalStateException("Edge to unknown node '" + to + "'");
            }
            successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            if (!from.equals(START)) {
              predecessorCounts.merge(to, 1, Integer::sum);
            }
          }
        });

    checkReachable(successors);
    checkAcyclic(successors, predecessorCounts);
    return new CompiledWorkflow<>(nodes, successors, predecessorCounts);
  }

  private WorkflowGraph<S> register(NodeDefinition<S> node) {
    if (node.name().equals(START) || node.name().equals(END)) {
      throw new IllegalArgumentException("Reserved node name: " + node.name());
    }
    if (nodes.putIfAbsent(node.name(), node) != null) {
      throw new IllegalArgumentException("Duplicate node name: " + node.name());
    }
    return this;
  }

  private void checkReachable(Map<String, List<String>> successors) {
    Set<String> seen = new HashSet<>();
    Deque<String> pending = new ArrayDeque<>(successors.getOrDefault(START, List.of()));
    while (!pending.isEmpty()) {
      String name = pending.pop();
      if (seen.add(name)) {
        pending.addAll(successors.getOrDefault(name, List.of()));
      }
    }
    for (String name : nodes.keySet()) {
      if (!seen.contains(name)) {
        throw new IllegalStateException("Node '" + name + "' is not reachable from START");
      }
    }
  }

  private void checkAcyclic(
      Map<String, List<String>> successors, Map<String, Integer> predecessorCounts) {
    Map<String, Integer> remaining = new HashMap<>(predecessorCounts);
    Deque<String> ready = new ArrayDeque<>();
    remaining.forEach(
        (name, count) -> {
          if (count == 0) {
            ready.add(name);
          }
        });
    int visited = 0;
    while (!ready.isEmpty()) {
      String name = ready.pop();
      visited++;
      for (String next : successors.getOrDefault(name, List.of())) {
        if (remaining.merge(next, -1, Integer::sum) == 0) {
          ready.add(next);
        }
      }
    }
    if (visited != nodes.size()) {
      throw new IllegalStateException("Workflow graph contains a cycle");
    }
  }

  record NodeDefinition<S>(String name, NodeAction<S> action, @Nullable Predicate<S> gate) {

    boolean isJoin() {
      return gate != null;
    }
  }
}

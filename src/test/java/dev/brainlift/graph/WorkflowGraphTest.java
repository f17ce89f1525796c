package dev.brainlift.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowGraphTest {

  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  /** A node that appends its own name to the visited list. */
  private static NodeAction<List<String>> visit(String name) {
    return state -> current -> append(current, name);
  }

  private static List<String> append(List<String> list, String name) {
    List<String> copy = new ArrayList<>(list);
    copy.add(name);
    return List.copyOf(copy);
  }

  private static WorkflowGraph<List<String>> fanOut(NodeAction<List<String>> branch) {
    return new WorkflowGraph<List<String>>()
        .addNode("plan", visit("plan"))
        .addNode("left", branch)
        .addNode("middle", branch)
        .addNode("right", branch)
        .addJoin("join", state -> state.size() == 4, visit("join"))
        .addEdge(WorkflowGraph.START, "plan")
        .addEdge("plan", "left")
        .addEdge("plan", "middle")
        .addEdge("plan", "right")
        .addEdge("left", "join")
        .addEdge("middle", "join")
        .addEdge("right", "join")
        .addEdge("join", WorkflowGraph.END);
  }

  @Nested
  class Compilation {

    @Test
    void requires_an_entry_edge() {
      WorkflowGraph<String> graph = new WorkflowGraph<String>().addNode("a", state -> s -> s);

      assertThatThrownBy(graph::compile)
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("entry edge");
    }

    @Test
    void rejects_edges_to_unknown_nodes() {
      WorkflowGraph<String> graph =
          new WorkflowGraph<String>()
              .addNode("a", state -> s -> s)
              .addEdge(WorkflowGraph.START, "a")
              .addEdge("a", "missing");

      assertThatThrownBy(graph::compile).hasMessageContaining("unknown node 'missing'");
    }

    @Test
    void rejects_unreachable_nodes() {
      WorkflowGraph<String> graph =
          new WorkflowGraph<String>()
              .addNode("a", state -> s -> s)
              .addNode("orphan", state -> s -> s)
              .addEdge(WorkflowGraph.START, "a");

      assertThatThrownBy(graph::compile).hasMessageContaining("'orphan' is not reachable");
    }

    @Test
    void rejects_cycles() {
      WorkflowGraph<String> graph =
          new WorkflowGraph<String>()
              .addNode("a", state -> s -> s)
              .addNode("b", state -> s -> s)
              .addEdge(WorkflowGraph.START, "a")
              .addEdge("a", "b")
              .addEdge("b", "a");

      assertThatThrownBy(graph::compile).hasMessageContaining("cycle");
    }

    @Test
    void rejects_reserved_and_duplicate_names() {
      WorkflowGraph<String> graph = new WorkflowGraph<String>().addNode("a", state -> s -> s);

      assertThatThrownBy(() -> graph.addNode("a", state -> s -> s))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> graph.addNode(WorkflowGraph.END, state -> s -> s))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> graph.addEdge(WorkflowGraph.END, "a"))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> graph.addEdge("a", WorkflowGraph.START))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposes_its_topology() {
      CompiledWorkflow<List<String>> workflow = fanOut(visit("branch")).compile();

      assertThat(workflow.nodeNames()).contains("plan", "left", "middle", "right", "join");
      assertThat(workflow.successorsOf("plan")).containsExactlyInAnyOrder("left", "middle", "right");
    }
  }

  @Nested
  class Execution {

    @Test
    void branches_run_in_parallel_and_all_updates_are_merged() throws Exception {
      CountDownLatch allBranchesRunning = new CountDownLatch(3);
      NodeAction<List<String>> branch =
          state -> {
            allBranchesRunning.countDown();
            if (!allBranchesRunning.await(5, TimeUnit.SECONDS)) {
              throw new IllegalStateException("branches did not run concurrently");
            }
            String name = Thread.currentThread().getName();
            return current -> append(current, "branch@" + name);
          };

      WorkflowRun<List<String>> run = fanOut(branch).compile().start(List.of(), executor);
      List<String> result = run.completion().get(5, TimeUnit.SECONDS);

      assertThat(result).hasSize(5).startsWith("plan").endsWith("join");
      assertThat(result.subList(1, 4)).allSatisfy(entry -> assertThat(entry).startsWith("branch@"));
      assertThat(run.skippedNodes()).isEmpty();
    }

    @Test
    void join_with_a_closed_gate_is_skipped() throws Exception {
      NodeAction<List<String>> quietBranch = state -> StateUpdate.none();

      WorkflowRun<List<String>> run = fanOut(quietBranch).compile().start(List.of(), executor);
      List<String> result = run.completion().get(5, TimeUnit.SECONDS);

      assertThat(result).containsExactly("plan");
      assertThat(run.skippedNodes()).containsExactly("join");
    }

    @Test
    void failing_node_aborts_the_run() {
      NodeAction<List<String>> failing =
          state -> {
            throw new IllegalStateException("search backend down");
          };
      WorkflowGraph<List<String>> graph =
          new WorkflowGraph<List<String>>()
              .addNode("plan", visit("plan"))
              .addNode("broken", failing)
              .addNode("after", visit("after"))
              .addEdge(WorkflowGraph.START, "plan")
              .addEdge("plan", "broken")
              .addEdge("broken", "after");

      WorkflowRun<List<String>> run = graph.compile().start(List.of(), executor);

      assertThatThrownBy(() -> run.completion().get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .cause()
          .isInstanceOf(WorkflowException.class)
          .hasMessageContaining("broken")
          .hasRootCauseMessage("search backend down");
      assertThat(run.currentState()).containsExactly("plan");
    }

    @Test
    void cancel_interrupts_running_nodes() throws Exception {
      CountDownLatch started = new CountDownLatch(1);
      CountDownLatch interrupted = new CountDownLatch(1);
      NodeAction<List<String>> blocking =
          state -> {
            started.countDown();
            try {
              Thread.sleep(10_000);
            } catch (InterruptedException e) {
              interrupted.countDown();
              throw e;
            }
            return StateUpdate.none();
          };
      WorkflowGraph<List<String>> graph =
          new WorkflowGraph<List<String>>()
              .addNode("blocking", blocking)
              .addEdge(WorkflowGraph.START, "blocking");
      WorkflowRun<List<String>> run = graph.compile().start(List.of(), executor);
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      run.cancel();

      assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
      assertThatThrownBy(() -> run.completion().get())
          .isInstanceOf(CancellationException.class);
    }
  }
}

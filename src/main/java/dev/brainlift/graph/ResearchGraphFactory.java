package dev.brainlift.graph;

import dev.brainlift.pipeline.QueryPlanner;
import dev.brainlift.pipeline.SourceAnalyzer;
import dev.brainlift.research.ResearchCategory;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the research workflow for a batch of jobs:
 *
 * <pre>
 * START -> analyzePurpose -> generateQueries -> expertBranch      -> synthesizeResults -> END
 *                                            -> contrarianBranch  ->
 *                                            -> knowledgeBranch   ->
 * </pre>
 *
 * <p>There is one branch per job. {@code synthesizeResults} is a join that only runs when every
 * branch recorded progress 100.
 */
public class ResearchGraphFactory {

  private static final Logger log = LoggerFactory.getLogger(ResearchGraphFactory.class);

  public static final String ANALYZE_PURPOSE = "analyzePurpose";
  public static final String GENERATE_QUERIES = "generateQueries";
  public static final String SYNTHESIZE_RESULTS = "synthesizeResults";

  private final QueryPlanner queryPlanner;

  public ResearchGraphFactory(QueryPlanner queryPlanner) {
    this.queryPlanner = queryPlanner;
  }

  /**
   * @param jobs the batch; one branch node is created per job
   * @param branchRunner runs a branch and reports the outcome as a state update
   */
  public CompiledWorkflow<ResearchGraphState> build(
      List<ResearchJob> jobs, BranchRunner branchRunner) {
    if (jobs.isEmpty()) {
      throw new IllegalArgumentException("A research workflow needs at least one job");
    }
    WorkflowGraph<ResearchGraphState> graph =
        new WorkflowGraph<ResearchGraphState>()
            .addNode(ANALYZE_PURPOSE, this::analyzePurpose)
            .addNode(GENERATE_QUERIES, this::generateQueries)
            .addJoin(SYNTHESIZE_RESULTS, ResearchGraphState::allBranchesComplete, this::synthesize)
            .addEdge(WorkflowGraph.START, ANALYZE_PURPOSE)
            .addEdge(ANALYZE_PURPOSE, GENERATE_QUERIES)
            .addEdge(SYNTHESIZE_RESULTS, WorkflowGraph.END);

    for (Map.Entry<String, String> branch : branchNames(jobs).entrySet()) {
      String jobId = branch.getKey();
      graph
          .addNode(branch.getValue(), state -> branchRunner.run(state.jobs().get(jobId)))
          .addEdge(GENERATE_QUERIES, branch.getValue())
          .addEdge(branch.getValue(), SYNTHESIZE_RESULTS);
    }
    return graph.compile();
  }

  /** Branch node names by job id: {@code expertBranch}, {@code contrarianBranch-2}, ... */
  static Map<String, String> branchNames(List<ResearchJob> jobs) {
    Map<String, String> names = new LinkedHashMap<>();
    Map<ResearchCategory, Integer> seen = new HashMap<>();
    for (ResearchJob job : jobs) {
      int occurrence = seen.merge(job.category(), 1, Integer::sum);
      String base = branchName(job.category());
      names.put(job.id(), occurrence == 1 ? base : base + "-" + occurrence);
    }
    return names;
  }

  static String branchName(ResearchCategory category) {
    return switch (category) {
      case EXPERTS -> "expertBranch";
      case CONTRARIAN_VIEWS -> "contrarianBranch";
      case KNOWLEDGE_MAP -> "knowledgeBranch";
    };
  }

  private StateUpdate<ResearchGraphState> analyzePurpose(ResearchGraphState state) {
    String purpose = state.jobs().values().iterator().next().purposeText();
    ResearchPlan plan =
        new ResearchPlan(queryPlanner.keyTerms(purpose), queryPlanner.subjectArea(purpose));
    log.debug(
        "Purpose analysis: key terms '{}', subject area '{}'", plan.keyTerms(), plan.subjectArea());
    return current -> current.withPlan(plan);
  }

  private StateUpdate<ResearchGraphState> generateQueries(ResearchGraphState state) {
    StateUpdate<ResearchGraphState> update = StateUpdate.none();
    for (ResearchJob job : state.jobs().values()) {
      if (!job.queries().isEmpty()) {
        continue;
      }
      ResearchJob planned =
          new ResearchJob(
              job.id(),
              job.category(),
              queryPlanner.planQueries(job.category(), job.purposeText()),
              job.purposeText(),
              job.requirements());
      StateUpdate<ResearchGraphState> previous = update;
      update = current -> previous.applyTo(current).withJob(planned);
    }
    return update;
  }

  private StateUpdate<ResearchGraphState> synthesize(ResearchGraphState state) {
    List<Source> allSources =
        state.results().values().stream().flatMap(result -> result.sources().stream()).toList();
    String perSection =
        state.results().values().stream()
            .map(result -> result.category().sectionTitle() + ": " + result.sources().size())
            .collect(Collectors.joining(", "));
    String synthesis =
        "Sections researched (" + perSection + "). " + SourceAnalyzer.summarize(allSources);
    log.info("Research workflow synthesized: {}", synthesis);
    return current -> current.withSynthesis(synthesis);
  }
}

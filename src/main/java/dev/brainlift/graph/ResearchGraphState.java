package dev.brainlift.graph;

import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchJob;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Immutable state flowing through one research workflow run. Every {@code with*} method returns a
 * new instance.
 *
 * @param plan purpose analysis, set by {@code analyzePurpose}
 * @param jobs the batch's jobs by id, with planned queries filled in by {@code generateQueries}
 * @param branchProgress last progress recorded per job; 100 once its branch completed
 * @param results completed branch results by job id
 * @param failures terminal branch failures by job id
 * @param synthesis overview written by {@code synthesizeResults}
 */
public record ResearchGraphState(
    @Nullable ResearchPlan plan,
    Map<String, ResearchJob> jobs,
    Map<String, Integer> branchProgress,
    Map<String, JobResult> results,
    Map<String, JobFailure> failures,
    @Nullable String synthesis) {

  public ResearchGraphState {
    jobs = freeze(jobs);
    branchProgress = freeze(branchProgress);
    results = freeze(results);
    failures = freeze(failures);
  }

  public static ResearchGraphState initial(List<ResearchJob> jobs) {
    Map<String, ResearchJob> byId = new LinkedHashMap<>();
    Map<String, Integer> progress = new LinkedHashMap<>();
    for (ResearchJob job : jobs) {
      byId.put(job.id(), job);
      progress.put(job.id(), 0);
    }
    return new ResearchGraphState(null, byId, progress, Map.of(), Map.of(), null);
  }

  public ResearchGraphState withPlan(ResearchPlan newPlan) {
    return new ResearchGraphState(newPlan, jobs, branchProgress, results, failures, synthesis);
  }

  public ResearchGraphState withJob(ResearchJob job) {
    return new ResearchGraphState(
        plan, put(jobs, job.id(), job), branchProgress, results, failures, synthesis);
  }

  public ResearchGraphState withBranchCompleted(JobResult result) {
    return new ResearchGraphState(
        plan,
        jobs,
        put(branchProgress, result.jobId(), 100),
        put(results, result.jobId(), result),
        failures,
        synthesis);
  }

  public ResearchGraphState withBranchFailed(JobFailure failure) {
    return new ResearchGraphState(
        plan, jobs, branchProgress, results, put(failures, failure.jobId(), failure), synthesis);
  }

  public ResearchGraphState withSynthesis(String text) {
    return new ResearchGraphState(plan, jobs, branchProgress, results, failures, text);
  }

  /** The join condition for {@code synthesizeResults}. */
  public boolean allBranchesComplete() {
    return !branchProgress.isEmpty()
        && branchProgress.values().stream().allMatch(progress -> progress == 100);
  }

  private static <K, V> Map<K, V> put(Map<K, V> source, K key, V value) {
    Map<K, V> copy = new LinkedHashMap<>(source);
    copy.put(key, value);
    return copy;
  }

  private static <K, V> Map<K, V> freeze(@Nullable Map<K, V> source) {
    return source == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}

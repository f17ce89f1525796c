package dev.brainlift.api;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/research/sessions/jobs}: caller-built jobs submitted as one session.
 *
 * @param documentId document the research is for
 * @param jobs the jobs; ids must be unique
 */
public record SubmitJobsRequest(String documentId, List<JobRequest> jobs) {

  /**
   * @param id job id
   * @param category category key or name
   * @param queries search queries; absent means planned from the purpose
   * @param purpose the purpose statement
   * @param requirements source requirements; absent means the defaults
   */
  public record JobRequest(
      String id,
      String category,
      @Nullable List<String> queries,
      String purpose,
      @Nullable RequirementsRequest requirements) {}
}

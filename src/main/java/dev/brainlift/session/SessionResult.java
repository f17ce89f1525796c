package dev.brainlift.session;

import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged results of a completed session.
 *
 * @param sessionId session identifier
 * @param documentId document the results belong to
 * @param resultsByCategory job results grouped by category, in completion order
 */
public record SessionResult(
    String sessionId, String documentId, Map<ResearchCategory, List<JobResult>> resultsByCategory) {

  public SessionResult {
    Map<ResearchCategory, List<JobResult>> copy = new EnumMap<>(ResearchCategory.class);
    resultsByCategory.forEach((category, results) -> copy.put(category, List.copyOf(results)));
    resultsByCategory = Collections.unmodifiableMap(copy);
  }

  public List<JobResult> results(ResearchCategory category) {
    return resultsByCategory.getOrDefault(category, List.of());
  }
}

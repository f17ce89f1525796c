package dev.brainlift.search;

import dev.brainlift.research.AnalysisDepth;
import java.util.List;

/**
 * Constraints applied to a single search call.
 *
 * @param includeDomains restrict results to these domains; empty for no restriction
 * @param excludeDomains never return results from these domains
 * @param depth search depth
 * @param maxResults maximum number of hits, at least 1
 */
public record SearchFilters(
    List<String> includeDomains, List<String> excludeDomains, AnalysisDepth depth, int maxResults) {

  public SearchFilters {
    includeDomains = includeDomains == null ? List.of() : List.copyOf(includeDomains);
    excludeDomains = excludeDomains == null ? List.of() : List.copyOf(excludeDomains);
    depth = depth == null ? AnalysisDepth.ADVANCED : depth;
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1, got: " + maxResults);
    }
  }
}

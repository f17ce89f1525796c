package dev.brainlift.api;

import dev.brainlift.research.AnalysisDepth;
import dev.brainlift.research.ResearchRequirements;
import dev.brainlift.research.SourceType;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Optional source requirements in a request body. Absent fields take their defaults. */
public record RequirementsRequest(
    @Nullable Integer targetSourceCount,
    @Nullable Set<SourceType> sourceTypes,
    @Nullable AnalysisDepth analysisDepth) {

  static ResearchRequirements toRequirements(@Nullable RequirementsRequest request) {
    if (request == null) {
      return ResearchRequirements.defaults();
    }
    return new ResearchRequirements(
        request.targetSourceCount() == null
            ? ResearchRequirements.DEFAULT_TARGET_SOURCE_COUNT
            : request.targetSourceCount(),
        request.sourceTypes(),
        request.analysisDepth());
  }
}

package dev.brainlift.research;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-job constraints on the sources a research job selects.
 *
 * @param targetSourceCount maximum number of sources kept after scoring (at least 1)
 * @param sourceTypes source types accepted by the job; an empty set accepts every type
 * @param analysisDepth search depth requested from the search collaborator
 */
public record ResearchRequirements(
    int targetSourceCount, Set<SourceType> sourceTypes, AnalysisDepth analysisDepth) {

  public static final int DEFAULT_TARGET_SOURCE_COUNT = 5;

  public ResearchRequirements {
    if (targetSourceCount < 1) {
      throw new IllegalArgumentException(
          "targetSourceCount must be at least 1, got: " + targetSourceCount);
    }
    sourceTypes =
        sourceTypes == null || sourceTypes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(sourceTypes));
    analysisDepth = analysisDepth == null ? AnalysisDepth.ADVANCED : analysisDepth;
  }

  /** Five sources of any type, advanced search depth. */
  public static ResearchRequirements defaults() {
    return new ResearchRequirements(DEFAULT_TARGET_SOURCE_COUNT, Set.of(), AnalysisDepth.ADVANCED);
  }

  /** Whether a source of the given type may be selected. */
  public boolean accepts(SourceType type) {
    return sourceTypes.isEmpty() || sourceTypes.contains(type);
  }
}

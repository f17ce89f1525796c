package dev.brainlift.research;

import java.util.List;

/**
 * One research task for a single category. Immutable once created.
 *
 * @param id unique job identifier
 * @param category the section this job researches
 * @param queries ordered search queries; the pipeline uses at most five of them
 * @param purposeText the document purpose the research serves
 * @param requirements source selection constraints
 */
public record ResearchJob(
    String id,
    ResearchCategory category,
    List<String> queries,
    String purposeText,
    ResearchRequirements requirements) {

  public ResearchJob {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Job id must not be blank");
    }
    if (category == null) {
      throw new IllegalArgumentException("Job category must not be null");
    }
    if (purposeText == null || purposeText.isBlank()) {
      throw new IllegalArgumentException("Job purpose must not be blank");
    }
    queries = queries == null ? List.of() : List.copyOf(queries);
    requirements = requirements == null ? ResearchRequirements.defaults() : requirements;
  }
}

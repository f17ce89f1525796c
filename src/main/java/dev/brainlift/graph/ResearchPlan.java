package dev.brainlift.graph;

/**
 * What {@code analyzePurpose} extracted from the purpose statement.
 *
 * @param keyTerms up to three significant words, or {@code general}
 * @param subjectArea coarse domain used to sharpen expert queries
 */
public record ResearchPlan(String keyTerms, String subjectArea) {}

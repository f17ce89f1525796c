package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchCategory;
import java.util.List;

/**
 * Category-specific search and generation settings.
 *
 * @param category the category described
 * @param includeDomains domains the search is restricted to, empty for the open web
 * @param excludeDomains domains never searched
 * @param appendSubjectArea whether queries are suffixed with the purpose's subject area
 * @param temperature generation temperature
 * @param maxTokens generation token limit
 */
public record CategoryProfile(
    ResearchCategory category,
    List<String> includeDomains,
    List<String> excludeDomains,
    boolean appendSubjectArea,
    double temperature,
    int maxTokens) {

  public CategoryProfile {
    includeDomains = List.copyOf(includeDomains);
    excludeDomains = List.copyOf(excludeDomains);
  }
}

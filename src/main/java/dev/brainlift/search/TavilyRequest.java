package dev.brainlift.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** JSON request body for the Tavily {@code /search} endpoint. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TavilyRequest(
    String query,
    String search_depth,
    List<String> include_domains,
    List<String> exclude_domains,
    int max_results,
    boolean include_raw_content) {

  public TavilyRequest {
    include_domains = include_domains == null ? List.of() : List.copyOf(include_domains);
    exclude_domains = exclude_domains == null ? List.of() : List.copyOf(exclude_domains);
  }

  static TavilyRequest of(String query, SearchFilters filters) {
    return new TavilyRequest(
        query,
        filters.depth().apiValue(),
        filters.includeDomains(),
        filters.excludeDomains(),
        filters.maxResults(),
        false);
  }
}

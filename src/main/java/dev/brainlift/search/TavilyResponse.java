package dev.brainlift.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Top-level JSON response from the Tavily {@code /search} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TavilyResponse(@Nullable String query, List<Result> results) {

  public TavilyResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** One search result as returned by Tavily. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(
      String title,
      String url,
      @Nullable String content,
      double score,
      @Nullable String published_date,
      @Nullable String author) {

    SearchHit toHit() {
      return new SearchHit(title, url, content, score, published_date, author);
    }
  }
}

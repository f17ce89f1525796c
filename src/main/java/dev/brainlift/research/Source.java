package dev.brainlift.research;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A scored, filtered search result used as evidence for synthesized content.
 *
 * @param id source identifier, unique within a job result
 * @param url canonical URL of the source
 * @param title page title
 * @param author author when the search collaborator reports one
 * @param publishDate publish date as reported by the search collaborator
 * @param sourceType classification derived from the URL
 * @param credibilityScore credibility in [1, 10]
 * @param relevanceScore relevance to the purpose in [1, 10]
 * @param keyQuotes up to three notable sentences from the content
 * @param summary short excerpt of the content
 */
public record Source(
    String id,
    String url,
    String title,
    @Nullable String author,
    @Nullable String publishDate,
    SourceType sourceType,
    double credibilityScore,
    double relevanceScore,
    List<String> keyQuotes,
    String summary) {

  public Source {
    keyQuotes = keyQuotes == null ? List.of() : List.copyOf(keyQuotes);
    summary = summary == null ? "" : summary;
  }
}

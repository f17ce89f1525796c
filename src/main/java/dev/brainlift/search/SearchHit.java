package dev.brainlift.search;

import org.jspecify.annotations.Nullable;

/**
 * A raw search result before scoring.
 *
 * @param title page title
 * @param url result URL
 * @param content extracted page text
 * @param nativeScore relevance score assigned by the search service, in [0, 1]
 * @param publishDate publish date in the format reported by the service
 * @param author author when known
 */
public record SearchHit(
    String title,
    String url,
    String content,
    double nativeScore,
    @Nullable String publishDate,
    @Nullable String author) {

  public SearchHit {
    title = title == null ? "" : title;
    url = url == null ? "" : url;
    content = content == null ? "" : content;
  }
}

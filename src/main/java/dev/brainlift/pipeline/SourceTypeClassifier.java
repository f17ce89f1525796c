package dev.brainlift.pipeline;

import dev.brainlift.research.SourceType;
import java.util.List;
import java.util.Locale;

/** Classifies a source by URL markers, checked in order academic, industry, news, blog. */
final class SourceTypeClassifier {

  private static final List<String> ACADEMIC_MARKERS =
      List.of(
          ".edu", ".ac.", "researchgate", "scholar.google", "arxiv", "pubmed", "ieee", "jstor",
          "springer");
  private static final List<String> INDUSTRY_MARKERS =
      List.of("mckinsey", "bcg.com", "deloitte", "pwc.com", "hbr.org");
  private static final List<String> NEWS_MARKERS =
      List.of("news", "reuters", "bloomberg", "wsj.com", "nytimes", "cnn.com", "bbc.");
  private static final List<String> BLOG_MARKERS = List.of("blog", "medium.com", "substack.com");

  private SourceTypeClassifier() {}

  static SourceType classify(String url) {
    String lower = url.toLowerCase(Locale.ROOT);
    if (containsAny(lower, ACADEMIC_MARKERS)) {
      return SourceType.ACADEMIC;
    }
    if (containsAny(lower, INDUSTRY_MARKERS)) {
      return SourceType.INDUSTRY;
    }
    if (containsAny(lower, NEWS_MARKERS)) {
      return SourceType.NEWS;
    }
    if (containsAny(lower, BLOG_MARKERS)) {
      return SourceType.BLOG;
    }
    return SourceType.OTHER;
  }

  private static boolean containsAny(String text, List<String> markers) {
    return markers.stream().anyMatch(text::contains);
  }
}

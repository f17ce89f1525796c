package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import java.util.List;
import java.util.Locale;

/**
 * Renders section content directly from the selected sources when generation is unavailable. The
 * output depends only on its inputs, so identical sources always render identical text.
 */
final class FallbackContentRenderer {

  private FallbackContentRenderer() {}

  static String render(ResearchJob job, List<Source> sources) {
    StringBuilder out = new StringBuilder();
    out.append("## ").append(job.category().sectionTitle()).append(" (fallback summary)\n\n");
    out.append("Generated content was unavailable. The strongest sources found for \"")
        .append(job.purposeText().trim())
        .append("\" are listed below.\n");

    int rank = 1;
    for (Source source : sources) {
      out.append('\n')
          .append(rank++)
          .append(". ")
          .append(source.title())
          .append(" (")
          .append(source.url())
          .append(")\n");
      out.append(
          String.format(
              Locale.ROOT,
              "   Credibility: %.1f/10, Relevance: %.1f/10\n",
              source.credibilityScore(),
              source.relevanceScore()));
      for (String quote : source.keyQuotes()) {
        out.append("   > ").append(quote).append('\n');
      }
    }
    return out.toString();
  }
}

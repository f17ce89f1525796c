package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import dev.brainlift.research.SourceType;
import dev.brainlift.search.SearchHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw search hits into the job's source list: filter, dedupe by URL, score, rank by
 * relevance and keep the top {@code targetSourceCount}.
 */
@Component
public class SourceAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(SourceAnalyzer.class);

  static final int SUMMARY_LENGTH = 200;

  private static final Comparator<Source> RANKING =
      Comparator.comparingDouble(Source::relevanceScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(Source::credibilityScore).reversed())
          .thenComparing(Source::url);

  private final SourceScorer scorer;

  public SourceAnalyzer(SourceScorer scorer) {
    this.scorer = scorer;
  }

  /**
   * Select the best sources for a job.
   *
   * @param hits raw hits from every query, in query order
   * @param job the job the sources are for
   * @return at most {@code targetSourceCount} sources, most relevant first
   */
  public List<Source> select(List<SearchHit> hits, ResearchJob job) {
    Map<String, SearchHit> unique = new LinkedHashMap<>();
    int discarded = 0;
    for (SearchHit hit : hits) {
      if (!scorer.isUsable(hit)) {
        discarded++;
        continue;
      }
      unique.merge(
          UrlNormalizer.dedupeKey(hit.url()),
          hit,
          (kept, candidate) -> candidate.nativeScore() > kept.nativeScore() ? candidate : kept);
    }

    List<Source> scored = new ArrayList<>();
    for (SearchHit hit : unique.values()) {
      SourceType type = SourceTypeClassifier.classify(hit.url());
      if (!job.requirements().accepts(type)) {
        continue;
      }
      scored.add(toSource(hit, type, job.purposeText()));
    }
    scored.sort(RANKING);

    List<Source> selected = new ArrayList<>();
    for (Source source : scored) {
      if (selected.size() == job.requirements().targetSourceCount()) {
        break;
      }
      selected.add(withId(source, job.id() + "-src-" + (selected.size() + 1)));
    }
    log.debug(
        "Job {}: {} hits, {} discarded, {} unique, {} selected",
        job.id(),
        hits.size(),
        discarded,
        unique.size(),
        selected.size());
    return selected;
  }

  /** Human-readable digest of a source list: counts, average scores, type mix and key domains. */
  public static String summarize(List<Source> sources) {
    if (sources.isEmpty()) {
      return "Analysis based on 0 sources.";
    }
    Map<SourceType, Integer> distribution = new LinkedHashMap<>();
    for (Source source : sources) {
      distribution.merge(source.sourceType(), 1, Integer::sum);
    }
    List<String> distributionParts = new ArrayList<>();
    distribution.forEach(
        (type, count) -> distributionParts.add(type.name().toLowerCase(Locale.ROOT) + ": " + count));
    List<String> domains =
        sources.stream()
            .map(source -> UrlNormalizer.host(source.url()))
            .filter(host -> !host.isEmpty())
            .distinct()
            .limit(3)
            .toList();

    return String.format(
        Locale.ROOT,
        "Analysis based on %d sources with average credibility score of %.1f/10 and relevance"
            + " score of %.1f/10. Source distribution: %s. Key domains: %s.",
        sources.size(),
        averageCredibility(sources),
        sources.stream().mapToDouble(Source::relevanceScore).average().orElse(0),
        String.join(", ", distributionParts),
        domains.isEmpty() ? "none" : String.join(", ", domains));
  }

  /** Mean credibility of the sources, 0 when there are none. */
  public static double averageCredibility(List<Source> sources) {
    return sources.stream().mapToDouble(Source::credibilityScore).average().orElse(0);
  }

  private Source toSource(SearchHit hit, SourceType type, String purpose) {
    return new Source(
        "",
        hit.url(),
        hit.title().trim(),
        hit.author(),
        hit.publishDate(),
        type,
        scorer.credibility(hit, type),
        scorer.relevance(hit, purpose),
        KeyQuoteExtractor.extract(hit.content()),
        excerpt(hit.content()));
  }

  private static Source withId(Source source, String id) {
    return new Source(
        id,
        source.url(),
        source.title(),
        source.author(),
        source.publishDate(),
        source.sourceType(),
        source.credibilityScore(),
        source.relevanceScore(),
        source.keyQuotes(),
        source.summary());
  }

  private static String excerpt(String content) {
    String trimmed = content.trim();
    return trimmed.length() <= SUMMARY_LENGTH
        ? trimmed
        : trimmed.substring(0, SUMMARY_LENGTH) + "...";
  }
}

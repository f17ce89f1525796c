package dev.brainlift.pipeline;

import dev.brainlift.research.SourceType;
import dev.brainlift.search.SearchHit;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Filters raw search hits and scores the survivors for credibility and relevance.
 *
 * <p>Both scores are clipped to [1, 10]. All weights come from {@link ScoringProperties}.
 */
@Component
public class SourceScorer {

  private static final Logger log = LoggerFactory.getLogger(SourceScorer.class);

  static final double MIN_SCORE = 1.0;
  static final double MAX_SCORE = 10.0;

  private static final int MIN_KEYWORD_LENGTH = 4;

  // ISO timestamp, RFC 1123 (as sent by most feeds), then a bare ISO date prefix
  private static final List<Function<String, LocalDate>> DATE_PARSERS =
      List.of(
          value -> OffsetDateTime.parse(value).toLocalDate(),
          value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate(),
          value -> LocalDate.parse(value.substring(0, 10)));

  private final ScoringProperties properties;
  private final Clock clock;

  public SourceScorer(ScoringProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /** Whether a hit has enough title, content and native relevance to be considered. */
  public boolean isUsable(SearchHit hit) {
    return hit.url().startsWith("http")
        && hit.title().trim().length() >= properties.getMinTitleLength()
        && hit.content().trim().length() >= properties.getMinContentLength()
        && hit.nativeScore() >= properties.getMinNativeScore();
  }

  public double credibility(SearchHit hit, SourceType type) {
    double score = properties.getBaseCredibility();
    if (type == SourceType.ACADEMIC) {
      score += properties.getAcademicBoost();
    } else if (type == SourceType.INDUSTRY) {
      score += properties.getIndustryBoost();
    }
    if (isRecent(hit.publishDate())) {
      score += properties.getRecencyBoost();
    }
    if (hit.content().length() > properties.getLongContentThreshold()) {
      score += properties.getLongContentBoost();
    }
    if (hit.nativeScore() > properties.getHighNativeScoreThreshold()) {
      score += properties.getHighNativeScoreBoost();
    } else if (hit.nativeScore() > properties.getMediumNativeScoreThreshold()) {
      score += properties.getMediumNativeScoreBoost();
    }
    return clip(score);
  }

  public double relevance(SearchHit hit, String purpose) {
    List<String> keywords = keywords(purpose);
    String title = hit.title().toLowerCase(Locale.ROOT);
    String content = hit.content().toLowerCase(Locale.ROOT);
    long titleMatches = keywords.stream().filter(title::contains).count();
    long contentMatches = keywords.stream().filter(content::contains).count();

    double score =
        properties.getBaseRelevance()
            + titleMatches * properties.getTitleMatchWeight()
            + contentMatches * properties.getContentMatchWeight()
            + hit.nativeScore() * properties.getNativeScoreWeight();
    return clip(score);
  }

  boolean isRecent(@Nullable String publishDate) {
    if (publishDate == null || publishDate.isBlank()) {
      return false;
    }
    LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    LocalDate cutoff = today.minusYears(properties.getRecencyWindowYears());
    return parseDate(publishDate).map(date -> date.isAfter(cutoff)).orElse(false);
  }

  static Optional<LocalDate> parseDate(String value) {
    String trimmed = value.trim();
    for (Function<String, LocalDate> parser : DATE_PARSERS) {
      try {
        return Optional.of(parser.apply(trimmed));
      } catch (DateTimeParseException | IndexOutOfBoundsException e) {
        log.trace("Publish date '{}' not in expected format: {}", trimmed, e.getMessage());
      }
    }
    return Optional.empty();
  }

  private static List<String> keywords(String purpose) {
    return Arrays.stream(purpose.toLowerCase(Locale.ROOT).split("\\s+"))
        .map(word -> word.replaceAll("[^\\p{L}\\p{N}-]", ""))
        .filter(word -> word.length() >= MIN_KEYWORD_LENGTH)
        .distinct()
        .toList();
  }

  private static double clip(double score) {
    return Math.min(MAX_SCORE, Math.max(MIN_SCORE, score));
  }
}

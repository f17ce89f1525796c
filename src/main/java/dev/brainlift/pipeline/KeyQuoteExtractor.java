package dev.brainlift.pipeline;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Picks up to three notable sentences from source content: sentences carrying an evidence phrase
 * first, otherwise mid-length sentences in document order.
 */
final class KeyQuoteExtractor {

  static final int MAX_QUOTES = 3;

  private static final List<String> EVIDENCE_PHRASES =
      List.of(
          "research shows", "study found", "study reveals", "found that", "according to",
          "data reveals", "evidence suggests", "experts believe", "findings indicate");

  private static final int MIN_SENTENCE_LENGTH = 20;
  private static final int FALLBACK_MIN_LENGTH = 50;
  private static final int FALLBACK_MAX_LENGTH = 200;

  private KeyQuoteExtractor() {}

  static List<String> extract(String content) {
    List<String> sentences =
        Arrays.stream(content.split("[.!?]+"))
            .map(String::trim)
            .filter(sentence -> sentence.length() > MIN_SENTENCE_LENGTH)
            .toList();

    List<String> quotes =
        sentences.stream()
            .filter(KeyQuoteExtractor::carriesEvidence)
            .limit(MAX_QUOTES)
            .toList();
    if (!quotes.isEmpty()) {
      return quotes;
    }
    return sentences.stream()
        .filter(s -> s.length() > FALLBACK_MIN_LENGTH && s.length() < FALLBACK_MAX_LENGTH)
        .limit(MAX_QUOTES)
        .toList();
  }

  private static boolean carriesEvidence(String sentence) {
    String lower = sentence.toLowerCase(Locale.ROOT);
    return EVIDENCE_PHRASES.stream().anyMatch(lower::contains);
  }
}

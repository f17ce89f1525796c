package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchCategory;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Derives search queries from a purpose statement when the caller does not supply any.
 *
 * <p>The purpose is reduced to its key terms (the first three words longer than four characters
 * that are not stop words) and substituted into five category-specific query templates.
 */
@Component
public class QueryPlanner {

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "for", "with", "that", "this", "have", "will", "from", "they", "been",
          "their", "said", "each", "which", "what", "were", "more", "very", "know", "just",
          "first", "also", "after", "back", "other", "many", "than", "then", "them", "these",
          "some", "would", "make", "like", "into", "time", "has", "two", "way", "could", "call",
          "who", "its", "now", "find", "long", "down", "day", "did", "get", "come", "made", "may",
          "part", "about", "there", "where", "while");

  private static final List<String> SUBJECT_AREAS =
      List.of("technology", "business", "science", "healthcare", "education");

  private static final int MAX_KEY_TERMS = 3;

  /** Five search queries for the category, built around the purpose's key terms. */
  public List<String> planQueries(ResearchCategory category, String purpose) {
    String terms = keyTerms(purpose);
    return switch (category) {
      case EXPERTS ->
          List.of(
              "leading experts " + terms,
              "top researchers " + terms,
              "thought leaders " + terms,
              terms + " professor university",
              terms + " director founder CEO");
      case CONTRARIAN_VIEWS ->
          List.of(
              terms + " conventional wisdom wrong",
              terms + " contrarian view evidence",
              terms + " debunked myths",
              terms + " surprising research findings",
              terms + " counterintuitive studies");
      case KNOWLEDGE_MAP ->
          List.of(
              terms + " current state tools systems",
              terms + " background knowledge",
              terms + " dependencies related fields",
              terms + " adjacent areas connections",
              terms + " existing solutions analysis");
    };
  }

  /**
   * The purpose's key terms joined by spaces, or {@code "general"} when none qualify.
   *
   * @param purpose free-text purpose statement
   */
  public String keyTerms(String purpose) {
    String terms =
        tokens(purpose).stream()
            .filter(word -> word.length() > 4 && !STOP_WORDS.contains(word))
            .limit(MAX_KEY_TERMS)
            .collect(Collectors.joining(" "));
    return terms.isEmpty() ? "general" : terms;
  }

  /** The first known subject area mentioned by the purpose, or {@code "general"}. */
  public String subjectArea(String purpose) {
    String lower = purpose.toLowerCase(Locale.ROOT);
    return SUBJECT_AREAS.stream().filter(lower::contains).findFirst().orElse("general");
  }

  private static List<String> tokens(String text) {
    return List.of(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}-]+")).stream()
        .filter(token -> !token.isEmpty())
        .toList();
  }
}

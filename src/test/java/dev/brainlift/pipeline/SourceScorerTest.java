package dev.brainlift.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.brainlift.fixture.MutableClock;
import dev.brainlift.fixture.SearchHitBuilder;
import dev.brainlift.research.SourceType;
import dev.brainlift.search.SearchHit;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class SourceScorerTest {

  private final ScoringProperties properties = new ScoringProperties();
  private final SourceScorer scorer =
      new SourceScorer(properties, MutableClock.at("2025-03-10T12:00:00Z"));

  @Test
  void credibilityAddsEveryApplicableBoostAndClipsAtTen() {
    SearchHit hit =
        new SearchHitBuilder()
            .publishDate("2024-11-02")
            .content("x".repeat(1500))
            .nativeScore(0.9)
            .build();

    assertThat(scorer.credibility(hit, SourceType.ACADEMIC)).isEqualTo(10.0);
  }

  @Test
  void credibilityForIndustrySourceWithMediumNativeScore() {
    SearchHit hit = new SearchHitBuilder().publishDate("2015-01-01").nativeScore(0.7).build();

    assertThat(scorer.credibility(hit, SourceType.INDUSTRY)).isEqualTo(8.0);
  }

  @Test
  void credibilityOfPlainSourceIsTheBase() {
    SearchHit hit = new SearchHitBuilder().nativeScore(0.5).build();

    assertThat(scorer.credibility(hit, SourceType.OTHER)).isEqualTo(5.0);
  }

  @Test
  void credibilityWeightsAreConfigurable() {
    properties.setAcademicBoost(1.0);
    SearchHit hit = new SearchHitBuilder().nativeScore(0.5).build();

    assertThat(scorer.credibility(hit, SourceType.ACADEMIC)).isEqualTo(6.0);
  }

  @Test
  void relevanceCountsTitleAndContentKeywordMatches() {
    SearchHit hit = new SearchHitBuilder().nativeScore(0.7).build();

    // raft and leader appear in the content only: 5 + 2 * 0.5 + 0.7 * 3
    assertThat(scorer.relevance(hit, "Raft leader election")).isCloseTo(8.1, within(1e-9));
  }

  @Test
  void relevanceIsClippedToTen() {
    SearchHit hit = new SearchHitBuilder().nativeScore(1.0).build();

    assertThat(scorer.relevance(hit, "Consensus protocols in distributed databases"))
        .isEqualTo(10.0);
  }

  @Test
  void hitsBelowThresholdsAreNotUsable() {
    assertThat(scorer.isUsable(new SearchHitBuilder().build())).isTrue();
    assertThat(scorer.isUsable(new SearchHitBuilder().title("Short").build())).isFalse();
    assertThat(scorer.isUsable(new SearchHitBuilder().content("Too short").build())).isFalse();
    assertThat(scorer.isUsable(new SearchHitBuilder().nativeScore(0.2).build())).isFalse();
    assertThat(scorer.isUsable(new SearchHitBuilder().url("ftp://example.org/file").build()))
        .isFalse();
  }

  @Test
  void parsesCommonPublishDateFormats() {
    assertThat(SourceScorer.parseDate("2024-05-01T10:00:00Z")).contains(LocalDate.of(2024, 5, 1));
    assertThat(SourceScorer.parseDate("Tue, 3 Jun 2008 11:05:30 GMT"))
        .contains(LocalDate.of(2008, 6, 3));
    assertThat(SourceScorer.parseDate("2024-05-01")).contains(LocalDate.of(2024, 5, 1));
    assertThat(SourceScorer.parseDate("last week")).isEmpty();
  }

  @Test
  void recencyUsesTheConfiguredWindow() {
    assertThat(scorer.isRecent("2023-01-01")).isTrue();
    assertThat(scorer.isRecent("2020-01-01")).isFalse();
    assertThat(scorer.isRecent(null)).isFalse();
    assertThat(scorer.isRecent("unknown")).isFalse();
  }
}

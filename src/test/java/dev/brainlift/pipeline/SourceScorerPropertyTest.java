package dev.brainlift.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.brainlift.fixture.MutableClock;
import dev.brainlift.research.SourceType;
import dev.brainlift.search.SearchHit;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.StringLength;

class SourceScorerPropertyTest {

  private final SourceScorer scorer =
      new SourceScorer(new ScoringProperties(), MutableClock.at("2025-03-10T12:00:00Z"));

  @Property
  void credibilityStaysWithinBounds(
      @ForAll @StringLength(max = 2000) String content,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double nativeScore,
      @ForAll SourceType type) {
    SearchHit hit =
        new SearchHit("A reasonably long title", "https://example.org", content, nativeScore, null, null);

    assertThat(scorer.credibility(hit, type)).isBetween(1.0, 10.0);
  }

  @Property
  void relevanceStaysWithinBounds(
      @ForAll @StringLength(max = 300) String title,
      @ForAll @StringLength(max = 300) String purpose,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double nativeScore) {
    SearchHit hit = new SearchHit(title, "https://example.org", title, nativeScore, null, null);

    assertThat(scorer.relevance(hit, purpose)).isBetween(1.0, 10.0);
  }
}

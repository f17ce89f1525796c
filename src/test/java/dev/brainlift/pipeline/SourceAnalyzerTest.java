package dev.brainlift.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import dev.brainlift.fixture.MutableClock;
import dev.brainlift.fixture.ResearchJobBuilder;
import dev.brainlift.fixture.SearchHitBuilder;
import dev.brainlift.research.AnalysisDepth;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.ResearchRequirements;
import dev.brainlift.research.Source;
import dev.brainlift.research.SourceType;
import dev.brainlift.search.SearchHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SourceAnalyzerTest {

  private final SourceAnalyzer analyzer =
      new SourceAnalyzer(
          new SourceScorer(new ScoringProperties(), MutableClock.at("2025-03-10T12:00:00Z")));

  private final ResearchJob job = new ResearchJobBuilder().id("job-1").build();

  @Test
  void sameUrlFromDifferentQueriesIsKeptOnceWithTheBetterHit() {
    List<SearchHit> hits =
        List.of(
            new SearchHitBuilder().url("http://www.example.org/raft/").nativeScore(0.5).build(),
            new SearchHitBuilder().url("https://example.org/raft").nativeScore(0.9).build());

    List<Source> sources = analyzer.select(hits, job);

    assertThat(sources).hasSize(1);
    assertThat(sources.get(0).url()).isEqualTo("https://example.org/raft");
  }

  @Test
  void unusableHitsAreDiscarded() {
    List<SearchHit> hits =
        List.of(
            new SearchHitBuilder().url("https://example.org/a").content("too short").build(),
            new SearchHitBuilder().url("https://example.org/b").build());

    assertThat(analyzer.select(hits, job)).extracting(Source::url)
        .containsExactly("https://example.org/b");
  }

  @Test
  void keepsTargetCountMostRelevantFirstWithSequentialIds() {
    List<SearchHit> hits = new ArrayList<>();
    for (int i = 1; i <= 8; i++) {
      hits.add(
          new SearchHitBuilder().url("https://example.org/" + i).nativeScore(0.3 + i * 0.05).build());
    }
    ResearchJob limited =
        new ResearchJobBuilder()
            .id("job-7")
            .purpose("Sourdough baking techniques")
            .requirements(new ResearchRequirements(3, Set.of(), AnalysisDepth.BASIC))
            .build();

    List<Source> sources = analyzer.select(hits, limited);

    assertThat(sources).extracting(Source::id)
        .containsExactly("job-7-src-1", "job-7-src-2", "job-7-src-3");
    assertThat(sources).extracting(Source::url)
        .containsExactly("https://example.org/8", "https://example.org/7", "https://example.org/6");
  }

  @Test
  void sourceTypeRequirementFiltersSources() {
    List<SearchHit> hits =
        List.of(
            new SearchHitBuilder().url("https://cs.stanford.edu/raft").build(),
            new SearchHitBuilder().url("https://medium.com/@dev/raft").build());
    ResearchJob academicOnly =
        new ResearchJobBuilder()
            .requirements(new ResearchRequirements(5, Set.of(SourceType.ACADEMIC), null))
            .build();

    List<Source> sources = analyzer.select(hits, academicOnly);

    assertThat(sources).extracting(Source::sourceType).containsExactly(SourceType.ACADEMIC);
  }

  @Test
  void sourcesCarryQuotesAndTruncatedSummary() {
    String longContent =
        "Research shows that leader election dominates recovery time. " + "y".repeat(300);
    List<Source> sources =
        analyzer.select(List.of(new SearchHitBuilder().content(longContent).build()), job);

    Source source = sources.get(0);
    assertThat(source.keyQuotes())
        .containsExactly("Research shows that leader election dominates recovery time");
    assertThat(source.summary()).hasSize(SourceAnalyzer.SUMMARY_LENGTH + 3).endsWith("...");
  }

  @Test
  void summarizeDescribesCountsScoresTypesAndDomains() {
    List<Source> sources =
        List.of(
            source("https://www.mit.edu/a", SourceType.ACADEMIC, 8.0, 6.0),
            source("https://mckinsey.com/b", SourceType.INDUSTRY, 6.0, 8.0));

    assertThat(SourceAnalyzer.summarize(sources))
        .isEqualTo(
            "Analysis based on 2 sources with average credibility score of 7.0/10 and relevance"
                + " score of 7.0/10. Source distribution: academic: 1, industry: 1."
                + " Key domains: mit.edu, mckinsey.com.");
  }

  @Test
  void summarizeOfNoSources() {
    assertThat(SourceAnalyzer.summarize(List.of())).isEqualTo("Analysis based on 0 sources.");
    assertThat(SourceAnalyzer.averageCredibility(List.of())).isZero();
  }

  private static Source source(String url, SourceType type, double credibility, double relevance) {
    return new Source("s", url, "Title", null, null, type, credibility, relevance, List.of(), "");
  }
}

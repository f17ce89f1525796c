package dev.brainlift.pipeline;

import dev.brainlift.generation.GenerationClient;
import dev.brainlift.generation.GenerationOptions;
import dev.brainlift.research.JobMetadata;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.ResearchException;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import dev.brainlift.research.TransientServiceException;
import dev.brainlift.search.SearchClient;
import dev.brainlift.search.SearchFilters;
import dev.brainlift.search.SearchHit;
import dev.brainlift.search.TavilyProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The production research pipeline: search, analyze, generate, with templated fallback content.
 *
 * <p>Checkpoints are reported at 10, 25, 50, 75 and 100 percent. Transient failures of single
 * queries are skipped. Quota and permanent search failures abort the job. A failed generation call
 * never fails the job; the content is rendered from the sources instead and flagged as fallback.
 */
@Component
public class ResearchJobPipeline implements ResearchPipeline {

  private static final Logger log = LoggerFactory.getLogger(ResearchJobPipeline.class);

  static final int MAX_QUERIES = 5;

  private final SearchClient searchClient;
  private final GenerationClient generationClient;
  private final SourceAnalyzer sourceAnalyzer;
  private final QueryPlanner queryPlanner;
  private final int resultsPerQuery;
  private final Clock clock;

  public ResearchJobPipeline(
      SearchClient searchClient,
      GenerationClient generationClient,
      SourceAnalyzer sourceAnalyzer,
      QueryPlanner queryPlanner,
      TavilyProperties searchProperties,
      Clock clock) {
    this.searchClient = searchClient;
    this.generationClient = generationClient;
    this.sourceAnalyzer = sourceAnalyzer;
    this.queryPlanner = queryPlanner;
    this.resultsPerQuery = searchProperties.maxResults();
    this.clock = clock;
  }

  @Override
  public JobResult execute(ResearchJob job, PipelineContext context) {
    Instant start = clock.instant();
    CategoryProfile profile = CategoryProfiles.forCategory(job.category());

    context.reportProgress(10, "Starting " + job.category().sectionTitle() + " research");
    context.checkNotStopped();

    context.reportProgress(25, "Searching for sources");
    SearchOutcome outcome = search(job, profile, context);
    long searchTimeMs = Duration.between(start, clock.instant()).toMillis();
    context.checkNotStopped();

    context.reportProgress(50, "Analyzing sources");
    List<Source> sources = sourceAnalyzer.select(outcome.hits(), job);
    if (sources.isEmpty()) {
      throw noSources(job, outcome);
    }
    context.reportPartialResult(sources);
    context.checkNotStopped();

    context.reportProgress(75, "Generating content");
    String content;
    boolean fallback;
    try {
      content =
          generationClient.complete(
              PromptTemplates.build(job.category(), job.purposeText(), sources),
              GenerationOptions.text(profile.temperature(), profile.maxTokens()));
      fallback = false;
    } catch (ResearchException e) {
      log.warn(
          "Generation failed for job {} ({}), rendering fallback content from {} sources",
          job.id(),
          e.getMessage(),
          sources.size());
      content = FallbackContentRenderer.render(job, sources);
      fallback = true;
    }
    context.checkNotStopped();

    context.reportProgress(100, "Research complete");
    long totalMs = Duration.between(start, clock.instant()).toMillis();
    JobMetadata metadata =
        new JobMetadata(
            searchTimeMs,
            Math.max(0, totalMs - searchTimeMs),
            outcome.attempted() + 1,
            SourceAnalyzer.averageCredibility(sources));
    return new JobResult(
        job.id(),
        context.workerId(),
        job.category(),
        sources,
        SourceAnalyzer.summarize(sources),
        content,
        fallback,
        metadata);
  }

  private SearchOutcome search(ResearchJob job, CategoryProfile profile, PipelineContext context) {
    List<String> queries =
        job.queries().isEmpty()
            ? queryPlanner.planQueries(job.category(), job.purposeText())
            : job.queries();
    String subjectArea =
        profile.appendSubjectArea() ? queryPlanner.subjectArea(job.purposeText()) : "general";
    SearchFilters filters =
        new SearchFilters(
            profile.includeDomains(),
            profile.excludeDomains(),
            job.requirements().analysisDepth(),
            resultsPerQuery);

    List<SearchHit> hits = new ArrayList<>();
    int attempted = 0;
    int transientFailures = 0;
    for (String query : queries.subList(0, Math.min(MAX_QUERIES, queries.size()))) {
      context.checkNotStopped();
      String effectiveQuery = "general".equals(subjectArea) ? query : query + " " + subjectArea;
      attempted++;
      try {
        hits.addAll(searchClient.search(effectiveQuery, filters));
      } catch (TransientServiceException e) {
        transientFailures++;
        log.warn("Skipping query '{}' for job {}: {}", effectiveQuery, job.id(), e.getMessage());
      }
    }
    return new SearchOutcome(hits, attempted, transientFailures);
  }

  private static ResearchException noSources(ResearchJob job, SearchOutcome outcome) {
    if (outcome.attempted() > 0 && outcome.transientFailures() == outcome.attempted()) {
      return new TransientServiceException(
          "All " + outcome.attempted() + " searches failed transiently for job " + job.id());
    }
    return new PermanentJobException(
        "No usable sources found for job "
            + job.id()
            + " ("
            + outcome.hits().size()
            + " raw results)");
  }

  private record SearchOutcome(List<SearchHit> hits, int attempted, int transientFailures) {}
}

package dev.brainlift.research;

import java.util.List;

/**
 * Outcome of a successfully completed research job.
 *
 * <p>{@code fallbackContent} is set when narrative generation failed and {@code generatedContent}
 * was rendered from the sources by a deterministic template instead.
 */
public record JobResult(
    String jobId,
    String workerId,
    ResearchCategory category,
    List<Source> sources,
    String analysisSummary,
    String generatedContent,
    boolean fallbackContent,
    JobMetadata metadata) {

  public JobResult {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}

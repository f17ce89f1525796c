package dev.brainlift.pipeline;

import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchJob;

/**
 * Runs one research job to completion on the calling thread.
 *
 * <p>Implementations report checkpoints through the {@link PipelineContext}, in increasing order,
 * and fail with a {@link dev.brainlift.research.ResearchException} subclass. Any other exception is
 * treated by the engines as a worker crash.
 */
public interface ResearchPipeline {

  JobResult execute(ResearchJob job, PipelineContext context);
}

package dev.brainlift.session;

import dev.brainlift.research.JobFailure;
import dev.brainlift.research.ResearchCategory;
import org.jspecify.annotations.Nullable;

/**
 * State of one job inside a {@link SessionSnapshot}.
 *
 * @param jobId job identifier
 * @param category job category
 * @param status lifecycle state
 * @param progress highest progress reported, in [0, 100]
 * @param statusMessage last stage description reported by the job
 * @param failure the failure that ended the job, if it failed
 */
public record JobSnapshot(
    String jobId,
    ResearchCategory category,
    JobStatus status,
    int progress,
    @Nullable String statusMessage,
    @Nullable JobFailure failure) {}

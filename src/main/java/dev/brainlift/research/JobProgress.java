package dev.brainlift.research;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A progress checkpoint reported by a running job.
 *
 * @param jobId the reporting job
 * @param workerId the slot executing the job
 * @param progress percentage in [0, 100]
 * @param status short description of the current stage
 * @param startTime when the current execution started
 * @param estimatedCompletion projected finish time, absent until some progress has been made
 */
public record JobProgress(
    String jobId,
    String workerId,
    int progress,
    String status,
    Instant startTime,
    @Nullable Instant estimatedCompletion) {}

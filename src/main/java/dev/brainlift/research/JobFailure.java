package dev.brainlift.research;

/**
 * A job failure surfaced to listeners once local recovery is exhausted.
 *
 * @param jobId the failed job
 * @param kind failure classification
 * @param message human-readable cause
 * @param retryable whether a later {@code retryFailedJobs} may resubmit the job
 * @param attempts number of executions the job went through
 */
public record JobFailure(
    String jobId, ErrorKind kind, String message, boolean retryable, int attempts) {}

package dev.brainlift.worker;

import dev.brainlift.research.JobListener;
import dev.brainlift.research.ResearchJob;

/**
 * A job waiting for a slot, with the listener it was submitted with.
 *
 * @param retryCount retries already consumed
 * @param progressSoFar highest progress already reported to the listener
 */
record QueuedJob(ResearchJob job, JobListener listener, int retryCount, int progressSoFar) {

    String jobId() {
        return job.id();
    }
}

package dev.brainlift.worker;

import dev.brainlift.research.JobListener;
import dev.brainlift.research.ResearchJob;
import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Manager-side bookkeeping for a job running on a slot. Owned by the control loop; the worker only
 * sees its {@link WorkerContext}.
 */
final class ActiveJobRecord {

    final ResearchJob job;
    final JobListener listener;
    final String workerSlotId;
    final long assignmentId;
    final Instant startTime;
    final int retryCount;
    final WorkerContext context;
    int progressSoFar;
    Future<?> execution;
    ScheduledFuture<?> timeout;

    ActiveJobRecord(ResearchJob job, JobListener listener, String workerSlotId, long assignmentId,
                    Instant startTime, int retryCount, int progressSoFar, WorkerContext context) {
        this.job = job;
        this.listener = listener;
        this.workerSlotId = workerSlotId;
        this.assignmentId = assignmentId;
        this.startTime = startTime;
        this.retryCount = retryCount;
        this.progressSoFar = progressSoFar;
        this.context = context;
    }

    /** Stop the worker and cancel the deadline. */
    void stop() {
        context.stop();
        if (timeout != null) {
            timeout.cancel(false);
        }
        if (execution != null) {
            execution.cancel(true);
        }
    }
}

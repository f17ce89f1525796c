package dev.brainlift.worker;

import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchException;
import dev.brainlift.research.Source;
import java.util.List;

/**
 * Messages posted by workers to the control loop. Each carries the assignment it belongs to so
 * that messages from a cancelled or timed-out execution can be recognised and dropped.
 */
sealed interface WorkerMessage {

    long assignmentId();

    String jobId();

    record ProgressUpdate(long assignmentId, String jobId, int progress, String status) implements WorkerMessage {
    }

    record PartialResult(long assignmentId, String jobId, List<Source> sources) implements WorkerMessage {
    }

    record JobCompleted(long assignmentId, String jobId, JobResult result) implements WorkerMessage {
    }

    record JobFailed(long assignmentId, String jobId, ResearchException error) implements WorkerMessage {
    }

    record WorkerCrashed(long assignmentId, String jobId, Throwable cause) implements WorkerMessage {
    }
}

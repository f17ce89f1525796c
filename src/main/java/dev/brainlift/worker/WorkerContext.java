package dev.brainlift.worker;

import dev.brainlift.pipeline.PipelineContext;
import dev.brainlift.research.Source;
import java.util.List;
import java.util.function.Consumer;

/** The worker-side view of one assignment: posts messages and observes the stop flag. */
final class WorkerContext implements PipelineContext {

    private final long assignmentId;
    private final String jobId;
    private final String workerId;
    private final Consumer<WorkerMessage> outbox;
    private volatile boolean stopped;

    WorkerContext(long assignmentId, String jobId, String workerId, Consumer<WorkerMessage> outbox) {
        this.assignmentId = assignmentId;
        this.jobId = jobId;
        this.workerId = workerId;
        this.outbox = outbox;
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public void reportProgress(int progress, String status) {
        if (!stopped) {
            outbox.accept(new WorkerMessage.ProgressUpdate(assignmentId, jobId, progress, status));
        }
    }

    @Override
    public void reportPartialResult(List<Source> sources) {
        if (!stopped) {
            outbox.accept(new WorkerMessage.PartialResult(assignmentId, jobId, List.copyOf(sources)));
        }
    }

    @Override
    public boolean isStopped() {
        return stopped;
    }

    void stop() {
        stopped = true;
    }

    long assignmentId() {
        return assignmentId;
    }

    String jobId() {
        return jobId;
    }
}

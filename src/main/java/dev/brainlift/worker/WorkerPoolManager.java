package dev.brainlift.worker;

import dev.brainlift.pipeline.JobStoppedException;
import dev.brainlift.pipeline.ResearchPipeline;
import dev.brainlift.research.ErrorKind;
import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobListener;
import dev.brainlift.research.JobProgress;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchEngine;
import dev.brainlift.research.ResearchException;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.WorkerStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs research jobs on a fixed set of worker slots.
 *
 * <p>All manager state (slot table, FIFO queue, active job records, pending retries) is owned by a
 * single-threaded control loop. Public methods and worker threads never touch it directly: they post
 * tasks or {@link WorkerMessage}s to the loop, which processes them serially. Listener callbacks
 * therefore run on the control loop thread, one at a time, and should return quickly.
 *
 * <p>Failure handling:
 *
 * <ul>
 *   <li>Transient failures and worker crashes are retried with exponential backoff up to {@link
 *       RetryPolicy#maxRetries()}; a retried job goes back to the front of the queue.
 *   <li>A crash or timeout counts against the slot. Below {@code maxWorkerFailures} the slot is
 *       respawned after {@code respawnDelay}; at the limit it is retired and capacity shrinks.
 *   <li>A timeout stops the worker and reports a retryable {@link ErrorKind#TIMEOUT} failure.
 * </ul>
 */
public class WorkerPoolManager implements ResearchEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolManager.class);

    private final ResearchPipeline pipeline;
    private final WorkerPoolProperties properties;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final ScheduledExecutorService controlLoop;
    private final ExecutorService workerThreads;
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private volatile Thread loopThread;

    // Control loop state
    private final List<WorkerSlot> slots = new ArrayList<>();
    private final Deque<QueuedJob> queue = new ArrayDeque<>();
    private final Map<String, ActiveJobRecord> active = new LinkedHashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingRetries = new HashMap<>();
    private long assignmentSequence;
    private volatile List<WorkerStatus> finalStatuses = List.of();

    public WorkerPoolManager(ResearchPipeline pipeline, WorkerPoolProperties properties, Clock clock) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.retryPolicy = properties.retryPolicy();
        this.clock = clock;
        this.controlLoop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "research-control");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        AtomicInteger workerThreadCount = new AtomicInteger();
        this.workerThreads = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "research-worker-" + workerThreadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        Instant now = clock.instant();
        for (int i = 1; i <= properties.poolSize(); i++) {
            slots.add(new WorkerSlot("worker-" + i, now));
        }
        log.info("Worker pool started with {} slots (timeout={}, maxRetries={}, maxWorkerFailures={})",
                properties.poolSize(), properties.jobTimeout(), properties.maxRetries(),
                properties.maxWorkerFailures());
    }

    @Override
    public void submit(ResearchJob job, JobListener listener) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(listener, "listener");
        if (shutdown.get()) {
            throw new IllegalStateException("Worker pool is shut down");
        }
        runOnLoop(() -> enqueue(new QueuedJob(job, listener, 0, 0)));
    }

    @Override
    public boolean cancelJob(String jobId) {
        if (shutdown.get()) {
            return false;
        }
        return !cancelJobs(List.of(jobId)).isEmpty();
    }

    @Override
    public List<String> cancelJobs(Collection<String> jobIds) {
        if (shutdown.get()) {
            return List.of();
        }
        return callOnLoop(() -> cancelOnLoop(jobIds));
    }

    @Override
    public List<WorkerStatus> getWorkerStatuses() {
        if (shutdown.get()) {
            return finalStatuses;
        }
        return callOnLoop(this::snapshotSlots);
    }

    /** Ids of the jobs currently executing, in assignment order. */
    public List<String> getActiveJobIds() {
        if (shutdown.get()) {
            return List.of();
        }
        return callOnLoop(() -> List.copyOf(active.keySet()));
    }

    /** Ids of the jobs waiting for a slot, in the order they will be assigned. */
    public List<String> getQueuedJobIds() {
        if (shutdown.get()) {
            return List.of();
        }
        return callOnLoop(() -> queue.stream().map(QueuedJob::jobId).toList());
    }

    public int getQueueLength() {
        return getQueuedJobIds().size();
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        try {
            callOnLoop(() -> {
                Instant now = clock.instant();
                pendingRetries.values().forEach(timer -> timer.cancel(false));
                pendingRetries.clear();
                active.values().forEach(ActiveJobRecord::stop);
                active.clear();
                queue.clear();
                slots.forEach(slot -> slot.retire(now));
                finalStatuses = snapshotSlots();
                return null;
            });
        } finally {
            controlLoop.shutdownNow();
            workerThreads.shutdownNow();
        }
        log.info("Worker pool shut down");
    }

    // ---------------------------------------------------------------------
    // Control loop
    // ---------------------------------------------------------------------

    private void enqueue(QueuedJob queued) {
        String jobId = queued.jobId();
        if (isLive(jobId)) {
            log.warn("Rejecting job {}: a job with the same id is already scheduled", jobId);
            notifyListener(queued.listener(), listener -> listener.onError(new JobFailure(
                    jobId, ErrorKind.PERMANENT, "Job " + jobId + " is already scheduled", false, 0)));
            return;
        }
        if (usableSlotCount() == 0) {
            failForLackOfCapacity(queued);
            return;
        }
        queue.addLast(queued);
        log.debug("Queued job {} ({} waiting)", jobId, queue.size());
        drainQueue();
    }

    private void drainQueue() {
        while (!queue.isEmpty()) {
            WorkerSlot slot = firstIdleSlot();
            if (slot == null) {
                return;
            }
            assign(queue.pollFirst(), slot);
        }
    }

    private void assign(QueuedJob queued, WorkerSlot slot) {
        Instant now = clock.instant();
        long assignmentId = ++assignmentSequence;
        ResearchJob job = queued.job();
        WorkerContext context = new WorkerContext(assignmentId, job.id(), slot.id(), this::post);
        ActiveJobRecord record = new ActiveJobRecord(job, queued.listener(), slot.id(), assignmentId, now,
                queued.retryCount(), queued.progressSoFar(), context);

        slot.assign(job.id(), now);
        active.put(job.id(), record);
        record.execution = workerThreads.submit(() -> runJob(job, context));
        record.timeout = controlLoop.schedule(guarded(() -> onTimeout(job.id(), assignmentId)),
                properties.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Assigned job {} ({}) to {}{}", job.id(), job.category().key(), slot.id(),
                queued.retryCount() > 0 ? " (retry " + queued.retryCount() + ")" : "");
    }

    private void handle(WorkerMessage message) {
        ActiveJobRecord record = active.get(message.jobId());
        if (record == null || record.assignmentId != message.assignmentId()) {
            log.debug("Dropping stale {} for job {}", message.getClass().getSimpleName(), message.jobId());
            return;
        }
        WorkerSlot slot = slot(record.workerSlotId);
        Instant now = clock.instant();
        slot.touch(now);

        if (message instanceof WorkerMessage.ProgressUpdate progress) {
            onProgress(record, progress, now);
        } else if (message instanceof WorkerMessage.PartialResult partial) {
            notifyListener(record.listener, listener -> listener.onPartialResult(partial.jobId(), partial.sources()));
        } else if (message instanceof WorkerMessage.JobCompleted completed) {
            settle(record);
            slot.completed(now);
            log.info("Job {} completed on {} ({} sources{})", record.job.id(), slot.id(),
                    completed.result().sources().size(),
                    completed.result().fallbackContent() ? ", fallback content" : "");
            JobResult result = completed.result();
            notifyListener(record.listener, listener -> listener.onComplete(result));
            drainQueue();
        } else if (message instanceof WorkerMessage.JobFailed failed) {
            settle(record);
            slot.jobFailed(now);
            ResearchException error = failed.error();
            handleFailure(record, error.kind(), error.getMessage(), error.retryable());
            drainQueue();
        } else if (message instanceof WorkerMessage.WorkerCrashed crashed) {
            settle(record);
            log.error("Worker {} crashed while running job {}", slot.id(), record.job.id(), crashed.cause());
            slotFailed(slot, now);
            handleFailure(record, ErrorKind.WORKER_CRASH, describe(crashed.cause()), true);
            drainQueue();
        }
    }

    private void onProgress(ActiveJobRecord record, WorkerMessage.ProgressUpdate update, Instant now) {
        if (update.progress() < record.progressSoFar) {
            return;
        }
        record.progressSoFar = update.progress();
        JobProgress progress = new JobProgress(record.job.id(), record.workerSlotId, update.progress(),
                update.status(), record.startTime, estimateCompletion(record.startTime, update.progress(), now));
        notifyListener(record.listener, listener -> listener.onProgress(progress));
    }

    private void onTimeout(String jobId, long assignmentId) {
        ActiveJobRecord record = active.get(jobId);
        if (record == null || record.assignmentId != assignmentId) {
            return;
        }
        Instant now = clock.instant();
        finish(record);
        WorkerSlot slot = slot(record.workerSlotId);
        log.warn("Job {} exceeded its {} timeout on {}; stopping worker", jobId, properties.jobTimeout(), slot.id());
        slotFailed(slot, now);
        JobFailure failure = new JobFailure(jobId, ErrorKind.TIMEOUT,
                "Job exceeded timeout of " + properties.jobTimeout().toMillis() + " ms", true,
                record.retryCount + 1);
        notifyListener(record.listener, listener -> listener.onError(failure));
        drainQueue();
    }

    /** Drop waiting and backing-off jobs first, then stop running ones; the queue is drained once. */
    private List<String> cancelOnLoop(Collection<String> jobIds) {
        List<String> cancelled = new ArrayList<>();
        List<String> running = new ArrayList<>();
        for (String jobId : jobIds) {
            if (queue.removeIf(queued -> queued.jobId().equals(jobId))) {
                log.info("Cancelled queued job {}", jobId);
                cancelled.add(jobId);
                continue;
            }
            ScheduledFuture<?> pending = pendingRetries.remove(jobId);
            if (pending != null) {
                pending.cancel(false);
                log.info("Cancelled job {} while waiting to retry", jobId);
                cancelled.add(jobId);
            } else if (active.containsKey(jobId)) {
                running.add(jobId);
            }
        }
        for (String jobId : running) {
            ActiveJobRecord record = active.get(jobId);
            finish(record);
            slot(record.workerSlotId).release(clock.instant());
            log.info("Cancelled running job {} on {}", jobId, record.workerSlotId);
            cancelled.add(jobId);
        }
        if (!running.isEmpty()) {
            drainQueue();
        }
        return cancelled;
    }

    /** Remove a job whose worker has returned from active tracking. */
    private void settle(ActiveJobRecord record) {
        active.remove(record.job.id());
        record.timeout.cancel(false);
    }

    /** Remove a job from active tracking and stop its still-running execution. */
    private void finish(ActiveJobRecord record) {
        active.remove(record.job.id());
        record.stop();
    }

    private void handleFailure(ActiveJobRecord record, ErrorKind kind, String message, boolean retryable) {
        String jobId = record.job.id();
        if (retryable && retryPolicy.canRetry(record.retryCount)) {
            int retry = record.retryCount + 1;
            Duration delay = retryPolicy.backoffFor(retry);
            log.warn("Job {} failed ({}: {}); retry {}/{} in {} ms", jobId, kind, message, retry,
                    retryPolicy.maxRetries(), delay.toMillis());
            QueuedJob requeued = new QueuedJob(record.job, record.listener, retry, record.progressSoFar);
            ScheduledFuture<?> timer = controlLoop.schedule(guarded(() -> requeue(requeued)),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
            pendingRetries.put(jobId, timer);
            return;
        }
        if (retryable) {
            log.error("Job {} failed after {} retries: {}", jobId, record.retryCount, message);
        } else {
            log.error("Job {} failed permanently ({}): {}", jobId, kind, message);
        }
        JobFailure failure = new JobFailure(jobId, kind, message, retryable, record.retryCount + 1);
        notifyListener(record.listener, listener -> listener.onError(failure));
    }

    private void requeue(QueuedJob queued) {
        if (pendingRetries.remove(queued.jobId()) == null) {
            return;
        }
        if (usableSlotCount() == 0) {
            failForLackOfCapacity(queued);
            return;
        }
        queue.addFirst(queued);
        drainQueue();
    }

    private void slotFailed(WorkerSlot slot, Instant now) {
        slot.crashed(now);
        if (slot.failureCount() < properties.maxWorkerFailures()) {
            int incarnation = slot.incarnation();
            log.info("Respawning {} in {} ms (failure {}/{})", slot.id(), properties.respawnDelay().toMillis(),
                    slot.failureCount(), properties.maxWorkerFailures());
            controlLoop.schedule(guarded(() -> respawn(slot, incarnation)),
                    properties.respawnDelay().toMillis(), TimeUnit.MILLISECONDS);
            return;
        }
        slot.retire(now);
        int remaining = usableSlotCount();
        log.warn("Retired {} after {} failures; pool capacity degraded to {}/{}", slot.id(), slot.failureCount(),
                remaining, slots.size());
        if (remaining == 0) {
            List<QueuedJob> stranded = new ArrayList<>(queue);
            queue.clear();
            stranded.forEach(this::failForLackOfCapacity);
        }
    }

    private void respawn(WorkerSlot slot, int incarnation) {
        if (slot.incarnation() != incarnation || slot.isRetired()) {
            return;
        }
        slot.respawn(clock.instant());
        log.info("{} respawned", slot.id());
        drainQueue();
    }

    private void failForLackOfCapacity(QueuedJob queued) {
        log.error("No worker capacity left; failing job {}", queued.jobId());
        JobFailure failure = new JobFailure(queued.jobId(), ErrorKind.WORKER_CRASH,
                "All worker slots are retired", false, queued.retryCount());
        notifyListener(queued.listener(), listener -> listener.onError(failure));
    }

    private boolean isLive(String jobId) {
        return active.containsKey(jobId) || pendingRetries.containsKey(jobId)
                || queue.stream().anyMatch(queued -> queued.jobId().equals(jobId));
    }

    private WorkerSlot firstIdleSlot() {
        for (WorkerSlot slot : slots) {
            if (slot.isIdle()) {
                return slot;
            }
        }
        return null;
    }

    private int usableSlotCount() {
        return (int) slots.stream().filter(slot -> !slot.isRetired()).count();
    }

    private WorkerSlot slot(String id) {
        for (WorkerSlot slot : slots) {
            if (slot.id().equals(id)) {
                return slot;
            }
        }
        throw new IllegalStateException("Unknown worker slot " + id);
    }

    private List<WorkerStatus> snapshotSlots() {
        return slots.stream().map(WorkerSlot::snapshot).toList();
    }

    private void notifyListener(JobListener listener, Consumer<JobListener> callback) {
        try {
            callback.accept(listener);
        } catch (RuntimeException e) {
            log.warn("Job listener threw; ignoring", e);
        }
    }

    // ---------------------------------------------------------------------
    // Worker side
    // ---------------------------------------------------------------------

    private void runJob(ResearchJob job, WorkerContext context) {
        try {
            JobResult result = pipeline.execute(job, context);
            post(new WorkerMessage.JobCompleted(context.assignmentId(), job.id(), result));
        } catch (JobStoppedException e) {
            log.debug("Worker {} stopped job {}", context.workerId(), job.id());
        } catch (ResearchException e) {
            post(new WorkerMessage.JobFailed(context.assignmentId(), job.id(), e));
        } catch (RuntimeException | Error e) {
            post(new WorkerMessage.WorkerCrashed(context.assignmentId(), job.id(), e));
        }
    }

    private void post(WorkerMessage message) {
        try {
            controlLoop.execute(guarded(() -> handle(message)));
        } catch (RejectedExecutionException e) {
            log.debug("Control loop stopped; dropping {} for job {}", message.getClass().getSimpleName(),
                    message.jobId());
        }
    }

    // ---------------------------------------------------------------------
    // Loop plumbing
    // ---------------------------------------------------------------------

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unexpected error on worker pool control loop", e);
            }
        };
    }

    private void runOnLoop(Runnable task) {
        try {
            controlLoop.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker pool is shut down", e);
        }
    }

    private <T> T callOnLoop(Callable<T> task) {
        if (Thread.currentThread() == loopThread) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        Future<T> future;
        try {
            future = controlLoop.submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Worker pool is shut down", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the worker pool", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    private static Instant estimateCompletion(Instant start, int progress, Instant now) {
        if (progress <= 0) {
            return null;
        }
        long elapsedMs = Duration.between(start, now).toMillis();
        return start.plusMillis(elapsedMs * 100 / progress);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

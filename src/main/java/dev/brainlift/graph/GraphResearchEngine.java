package dev.brainlift.graph;

import dev.brainlift.pipeline.JobStoppedException;
import dev.brainlift.pipeline.ResearchPipeline;
import dev.brainlift.research.ErrorKind;
import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobListener;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchEngine;
import dev.brainlift.research.ResearchException;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.WorkerStatus;
import dev.brainlift.worker.RetryPolicy;
import dev.brainlift.worker.WorkerPoolProperties;
import dev.brainlift.worker.WorkerSlot;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResearchEngine} that runs each submitted batch as a research workflow: purpose analysis,
 * query planning, one parallel branch per job, and a synthesis join.
 *
 * <p>Branch nodes share a table of {@code poolSize} slots, so no more than that many pipelines run
 * at once. Each pipeline attempt has the configured timeout. Transient failures and crashes are
 * retried inside the branch with exponential backoff; timeouts are reported as retryable {@link
 * ErrorKind#TIMEOUT} failures. The synthesis of the latest fully completed batch is available from
 * {@link #getLastSynthesis()}.
 */
public class GraphResearchEngine implements ResearchEngine {

  private static final Logger log = LoggerFactory.getLogger(GraphResearchEngine.class);

  private final ResearchGraphFactory graphFactory;
  private final ResearchPipeline pipeline;
  private final WorkerPoolProperties properties;
  private final RetryPolicy retryPolicy;
  private final Clock clock;
  private final ExecutorService nodeThreads;
  private final ExecutorService pipelineThreads;
  private final ScheduledExecutorService timers;
  private final SlotTable slots;
  private final Map<String, BranchHandle> handles = new ConcurrentHashMap<>();
  private final Set<WorkflowRun<ResearchGraphState>> runs = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean shutdown = new AtomicBoolean();
  private final AtomicReference<String> lastSynthesis = new AtomicReference<>();

  public GraphResearchEngine(
      ResearchGraphFactory graphFactory,
      ResearchPipeline pipeline,
      WorkerPoolProperties properties,
      Clock clock) {
    this.graphFactory = graphFactory;
    this.pipeline = pipeline;
    this.properties = properties;
    this.retryPolicy = properties.retryPolicy();
    this.clock = clock;
    this.nodeThreads = Executors.newCachedThreadPool(daemonThreads("research-graph-"));
    this.pipelineThreads = Executors.newCachedThreadPool(daemonThreads("research-branch-"));
    this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("research-graph-timer-"));
    this.slots =
        new SlotTable(
            properties.poolSize(),
            properties.maxWorkerFailures(),
            properties.respawnDelay(),
            timers,
            clock);
    log.info(
        "Graph research engine started with {} slots (timeout={}, maxRetries={})",
        properties.poolSize(),
        properties.jobTimeout(),
        properties.maxRetries());
  }

  @Override
  public void submit(ResearchJob job, JobListener listener) {
    submitParallelJobs(List.of(job), listener);
  }

  /** Run the jobs as one workflow, one branch per job. */
  @Override
  public void submitParallelJobs(List<ResearchJob> jobs, JobListener listener) {
    Objects.requireNonNull(listener, "listener");
    if (shutdown.get()) {
      throw new IllegalStateException("Graph research engine is shut down");
    }
    List<ResearchJob> accepted = new ArrayList<>();
    Map<String, BranchHandle> batch = new ConcurrentHashMap<>();
    for (ResearchJob job : jobs) {
      BranchHandle handle = new BranchHandle(job, listener, clock);
      if (handles.putIfAbsent(job.id(), handle) != null) {
        log.warn("Rejecting job {}: a job with the same id is already scheduled", job.id());
        handle.fail(
            new JobFailure(
                job.id(), ErrorKind.PERMANENT, "Job " + job.id() + " is already scheduled", false, 0));
        continue;
      }
      batch.put(job.id(), handle);
      accepted.add(job);
    }
    if (accepted.isEmpty()) {
      return;
    }
    slots.enqueue(accepted.stream().map(ResearchJob::id).toList());

    CompiledWorkflow<ResearchGraphState> workflow =
        graphFactory.build(accepted, job -> runBranch(batch.get(job.id()), job));
    WorkflowRun<ResearchGraphState> run =
        workflow.start(ResearchGraphState.initial(accepted), nodeThreads);
    runs.add(run);
    log.info("Started research workflow for {} job(s)", accepted.size());
    run.completion().whenComplete((state, error) -> onRunFinished(run, batch, state, error));
  }

  @Override
  public boolean cancelJob(String jobId) {
    BranchHandle handle = handles.remove(jobId);
    if (handle == null || !handle.cancel()) {
      return false;
    }
    slots.withdraw(jobId);
    log.info("Cancelled job {}", jobId);
    return true;
  }

  /** Cancels jobs that hold no slot before the running ones, whose slots would go to waiting jobs. */
  @Override
  public List<String> cancelJobs(Collection<String> jobIds) {
    Set<String> running = new HashSet<>();
    for (WorkerStatus status : slots.snapshot()) {
      if (status.currentJobId() != null) {
        running.add(status.currentJobId());
      }
    }
    List<String> ordered = new ArrayList<>();
    jobIds.stream().filter(jobId -> !running.contains(jobId)).forEach(ordered::add);
    jobIds.stream().filter(running::contains).forEach(ordered::add);

    List<String> cancelled = new ArrayList<>();
    for (String jobId : ordered) {
      if (cancelJob(jobId)) {
        cancelled.add(jobId);
      }
    }
    return cancelled;
  }

  @Override
  public List<WorkerStatus> getWorkerStatuses() {
    return slots.snapshot();
  }

  /** Ids of the jobs waiting for a slot, in the order they will get one. */
  public List<String> getQueuedJobIds() {
    return slots.waitingJobIds();
  }

  /** Overview written by the most recent workflow whose branches all completed. */
  public Optional<String> getLastSynthesis() {
    return Optional.ofNullable(lastSynthesis.get());
  }

  /** Ids of the jobs that have been submitted and are not finished yet. */
  public List<String> getLiveJobIds() {
    return handles.values().stream()
        .filter(handle -> !handle.isFinished())
        .map(handle -> handle.job().id())
        .toList();
  }

  @Override
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    handles.values().forEach(BranchHandle::cancel);
    handles.clear();
    runs.forEach(WorkflowRun::cancel);
    runs.clear();
    slots.retireAll();
    nodeThreads.shutdownNow();
    pipelineThreads.shutdownNow();
    timers.shutdownNow();
    log.info("Graph research engine shut down");
  }

  // ---------------------------------------------------------------------
  // Branch execution, on a node thread
  // ---------------------------------------------------------------------

  private StateUpdate<ResearchGraphState> runBranch(BranchHandle handle, ResearchJob job) {
    if (!handle.bind(Thread.currentThread())) {
      return StateUpdate.none();
    }
    try {
      return attemptUntilSettled(handle, job);
    } catch (InterruptedException e) {
      log.debug("Branch for job {} interrupted", job.id());
      return StateUpdate.none();
    } finally {
      handle.unbind();
      // Clear an interrupt that raced with the branch finishing.
      Thread.interrupted();
      slots.withdraw(job.id());
      handles.remove(job.id(), handle);
    }
  }

  private StateUpdate<ResearchGraphState> attemptUntilSettled(BranchHandle handle, ResearchJob job)
      throws InterruptedException {
    int retries = 0;
    while (!handle.isCancelled()) {
      WorkerSlot slot = slots.acquire(job.id());
      if (slot == null) {
        log.error("No worker capacity left; failing job {}", job.id());
        return failed(
            handle,
            new JobFailure(
                job.id(), ErrorKind.WORKER_CRASH, "All worker slots are retired", false, retries));
      }
      log.info(
          "Running job {} ({}) on {}{}",
          job.id(),
          job.category().key(),
          slot.id(),
          retries > 0 ? " (retry " + retries + ")" : "");

      BranchContext context = new BranchContext(handle, slot.id());
      FutureTask<JobResult> execution = new FutureTask<>(() -> pipeline.execute(job, context));
      if (!handle.startAttempt(context, execution)) {
        slots.release(slot);
        return StateUpdate.none();
      }
      // A cancel after this point cancels the task, so it never runs if it has not started.
      pipelineThreads.execute(execution);

      ErrorKind kind;
      String message;
      boolean retryable;
      try {
        JobResult result = execution.get(properties.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
        slots.completed(slot);
        if (!handle.complete(result)) {
          return StateUpdate.none();
        }
        log.info("Job {} completed on {} ({} sources)", job.id(), slot.id(), result.sources().size());
        return state -> state.withBranchCompleted(result);
      } catch (TimeoutException e) {
        context.stop();
        execution.cancel(true);
        log.warn("Job {} exceeded its {} timeout on {}", job.id(), properties.jobTimeout(), slot.id());
        slots.failed(slot);
        return failed(
            handle,
            new JobFailure(
                job.id(),
                ErrorKind.TIMEOUT,
                "Job exceeded timeout of " + properties.jobTimeout().toMillis() + " ms",
                true,
                retries + 1));
      } catch (CancellationException e) {
        slots.release(slot);
        return StateUpdate.none();
      } catch (InterruptedException e) {
        context.stop();
        execution.cancel(true);
        slots.release(slot);
        throw e;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof JobStoppedException) {
          slots.release(slot);
          return StateUpdate.none();
        }
        if (cause instanceof ResearchException error) {
          slots.jobFailed(slot);
          kind = error.kind();
          message = error.getMessage();
          retryable = error.retryable();
        } else {
          log.error("Worker {} crashed while running job {}", slot.id(), job.id(), cause);
          slots.failed(slot);
          kind = ErrorKind.WORKER_CRASH;
          message = describe(cause);
          retryable = true;
        }
      }

      if (!retryable || !retryPolicy.canRetry(retries)) {
        log.error("Job {} failed ({}, {} attempt(s)): {}", job.id(), kind, retries + 1, message);
        return failed(handle, new JobFailure(job.id(), kind, message, retryable, retries + 1));
      }
      retries++;
      Duration delay = retryPolicy.backoffFor(retries);
      log.warn(
          "Job {} failed ({}: {}); retry {}/{} in {} ms",
          job.id(),
          kind,
          message,
          retries,
          retryPolicy.maxRetries(),
          delay.toMillis());
      Thread.sleep(delay.toMillis());
      slots.requeueFirst(job.id());
    }
    return StateUpdate.none();
  }

  private static StateUpdate<ResearchGraphState> failed(BranchHandle handle, JobFailure failure) {
    if (!handle.fail(failure)) {
      return StateUpdate.none();
    }
    return state -> state.withBranchFailed(failure);
  }

  private void onRunFinished(
      WorkflowRun<ResearchGraphState> run,
      Map<String, BranchHandle> batch,
      ResearchGraphState state,
      Throwable error) {
    runs.remove(run);
    if (error == null) {
      if (state.synthesis() != null) {
        lastSynthesis.set(state.synthesis());
      }
      if (!run.skippedNodes().isEmpty()) {
        log.info("Research workflow finished without synthesis; not every branch completed");
      }
      return;
    }
    if (error instanceof CancellationException) {
      return;
    }
    log.error("Research workflow aborted", error);
    for (BranchHandle handle : batch.values()) {
      slots.withdraw(handle.job().id());
      handles.remove(handle.job().id(), handle);
      handle.fail(
          new JobFailure(
              handle.job().id(),
              ErrorKind.PERMANENT,
              "Research workflow aborted: " + describe(error),
              false,
              0));
    }
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger count = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}

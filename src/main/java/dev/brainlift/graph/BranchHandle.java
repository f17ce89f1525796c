package dev.brainlift.graph;

import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobListener;
import dev.brainlift.research.JobProgress;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks one submitted job inside the graph engine and gates its listener.
 *
 * <p>Listener callbacks are made while holding the handle's monitor, so they are serial for the
 * job. After {@link #cancel()} or a terminal callback nothing else is delivered. Progress is only
 * forwarded from the current attempt's context and never decreases.
 */
final class BranchHandle {

  private static final Logger log = LoggerFactory.getLogger(BranchHandle.class);

  private final ResearchJob job;
  private final JobListener listener;
  private final Clock clock;

  private boolean cancelled;
  private boolean terminal;
  private int progressSoFar;
  private @Nullable Instant attemptStart;
  private @Nullable BranchContext currentContext;
  private @Nullable Future<?> execution;
  private @Nullable Thread waiter;

  BranchHandle(ResearchJob job, JobListener listener, Clock clock) {
    this.job = job;
    this.listener = listener;
    this.clock = clock;
  }

  ResearchJob job() {
    return job;
  }

  synchronized boolean isCancelled() {
    return cancelled;
  }

  synchronized boolean isFinished() {
    return cancelled || terminal;
  }

  /** Register the thread driving this branch so that cancellation can interrupt it. */
  synchronized boolean bind(Thread thread) {
    if (cancelled) {
      return false;
    }
    waiter = thread;
    return true;
  }

  synchronized void unbind() {
    waiter = null;
  }

  synchronized boolean startAttempt(BranchContext context, Future<?> attempt) {
    if (cancelled) {
      return false;
    }
    currentContext = context;
    execution = attempt;
    attemptStart = clock.instant();
    return true;
  }

  synchronized void progress(BranchContext context, int progress, String status) {
    if (!accepts(context) || progress < progressSoFar) {
      return;
    }
    progressSoFar = progress;
    Instant now = clock.instant();
    Instant start = attemptStart == null ? now : attemptStart;
    JobProgress update =
        new JobProgress(
            job.id(),
            context.workerId(),
            progress,
            status,
            start,
            estimateCompletion(start, progress, now));
    notifyListener(target -> target.onProgress(update));
  }

  synchronized void partialResult(BranchContext context, List<Source> sources) {
    if (accepts(context)) {
      notifyListener(target -> target.onPartialResult(job.id(), sources));
    }
  }

  /** @return false if the job was cancelled or already finished */
  synchronized boolean complete(JobResult result) {
    if (cancelled || terminal) {
      return false;
    }
    terminal = true;
    notifyListener(target -> target.onComplete(result));
    return true;
  }

  /** @return false if the job was cancelled or already finished */
  synchronized boolean fail(JobFailure failure) {
    if (cancelled || terminal) {
      return false;
    }
    terminal = true;
    notifyListener(target -> target.onError(failure));
    return true;
  }

  /**
   * Stop the job and silence its listener.
   *
   * @return false if the job had already finished
   */
  synchronized boolean cancel() {
    if (cancelled || terminal) {
      return false;
    }
    cancelled = true;
    if (currentContext != null) {
      currentContext.stop();
    }
    if (execution != null) {
      execution.cancel(true);
    }
    if (waiter != null) {
      waiter.interrupt();
    }
    return true;
  }

  private boolean accepts(BranchContext context) {
    return !cancelled && !terminal && context == currentContext;
  }

  private void notifyListener(Consumer<JobListener> callback) {
    try {
      callback.accept(listener);
    } catch (RuntimeException e) {
      log.warn("Job listener threw for job {}; ignoring", job.id(), e);
    }
  }

  private static @Nullable Instant estimateCompletion(Instant start, int progress, Instant now) {
    if (progress <= 0) {
      return null;
    }
    long elapsedMs = Duration.between(start, now).toMillis();
    return start.plusMillis(elapsedMs * 100 / progress);
  }
}

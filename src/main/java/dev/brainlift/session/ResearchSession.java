package dev.brainlift.session;

import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobListener;
import dev.brainlift.research.JobProgress;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchCategory;
import dev.brainlift.research.ResearchJob;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates progress and results for the jobs submitted together for one document.
 *
 * <p>The session is the {@link JobListener} of each of its jobs. State changes happen under the
 * session's monitor; {@link SessionListener} and {@link ResearchDocumentSink} callbacks are invoked
 * after the monitor is released.
 *
 * <ul>
 *   <li>Per-job progress never decreases while the job is running; {@code overallProgress} is the
 *       mean over all jobs.
 *   <li>{@link SessionListener#onSessionComplete} fires exactly once, when the last job completes.
 *   <li>Once every job is terminal and at least one failed, the status becomes {@link
 *       SessionStatus#ERROR}; the other results are kept.
 * </ul>
 */
public class ResearchSession implements JobListener {

  private static final Logger log = LoggerFactory.getLogger(ResearchSession.class);

  private final String id;
  private final String documentId;
  private final Clock clock;
  private final Instant createdAt;
  private final SessionListener listener;
  private final List<ResearchDocumentSink> sinks;
  private final Map<String, TrackedJob> jobs = new LinkedHashMap<>();
  private final Map<ResearchCategory, List<JobResult>> resultsByCategory =
      new EnumMap<>(ResearchCategory.class);
  private final AtomicBoolean completionSignalled = new AtomicBoolean();

  private SessionStatus status = SessionStatus.RUNNING;
  private @Nullable Instant finishedAt;

  public ResearchSession(
      String id,
      String documentId,
      List<ResearchJob> jobs,
      SessionListener listener,
      List<ResearchDocumentSink> sinks,
      Clock clock) {
    if (jobs.isEmpty()) {
      throw new IllegalArgumentException("A session needs at least one job");
    }
    this.id = id;
    this.documentId = documentId;
    this.listener = listener;
    this.sinks = List.copyOf(sinks);
    this.clock = clock;
    this.createdAt = clock.instant();
    for (ResearchJob job : jobs) {
      if (this.jobs.putIfAbsent(job.id(), new TrackedJob(job)) != null) {
        throw new IllegalArgumentException("Duplicate job id in session: " + job.id());
      }
    }
  }

  public String id() {
    return id;
  }

  public String documentId() {
    return documentId;
  }

  public synchronized List<ResearchJob> jobs() {
    return jobs.values().stream().map(tracked -> tracked.job).toList();
  }

  public synchronized boolean containsJob(String jobId) {
    return jobs.containsKey(jobId);
  }

  public synchronized SessionStatus status() {
    return status;
  }

  public synchronized double overallProgress() {
    return computeOverallProgress();
  }

  public synchronized Optional<Instant> finishedAt() {
    return Optional.ofNullable(finishedAt);
  }

  public synchronized SessionSnapshot snapshot() {
    List<JobSnapshot> jobSnapshots = new ArrayList<>();
    for (TrackedJob tracked : jobs.values()) {
      jobSnapshots.add(
          new JobSnapshot(
              tracked.job.id(),
              tracked.job.category(),
              tracked.status,
              tracked.progress,
              tracked.statusMessage,
              tracked.failure));
    }
    return new SessionSnapshot(
        id, documentId, status, computeOverallProgress(), jobSnapshots, createdAt, finishedAt);
  }

  /** Merged results collected so far. */
  public synchronized SessionResult result() {
    return new SessionResult(id, documentId, resultsByCategory);
  }

  @Override
  public void onProgress(JobProgress progress) {
    SessionSnapshot snapshot;
    synchronized (this) {
      TrackedJob tracked = jobs.get(progress.jobId());
      if (tracked == null || tracked.status.isTerminal()) {
        return;
      }
      tracked.status = JobStatus.RUNNING;
      tracked.statusMessage = progress.status();
      tracked.progress = Math.max(tracked.progress, clamp(progress.progress()));
      snapshot = snapshot();
    }
    publishProgress(snapshot);
    notifyListener(() -> listener.onJobProgress(snapshot, progress));
  }

  @Override
  public void onComplete(JobResult result) {
    SessionSnapshot snapshot;
    boolean sessionComplete;
    synchronized (this) {
      TrackedJob tracked = jobs.get(result.jobId());
      if (tracked == null || tracked.status.isTerminal()) {
        return;
      }
      tracked.status = JobStatus.COMPLETED;
      tracked.progress = 100;
      tracked.statusMessage = "Research complete";
      resultsByCategory.computeIfAbsent(result.category(), c -> new ArrayList<>()).add(result);
      sessionComplete =
          jobs.values().stream().allMatch(job -> job.status == JobStatus.COMPLETED)
              && completionSignalled.compareAndSet(false, true);
      if (sessionComplete) {
        status = SessionStatus.COMPLETED;
        finishedAt = clock.instant();
      } else {
        updateTerminalStatus();
      }
      snapshot = snapshot();
    }
    publishProgress(snapshot);
    notifyListener(() -> listener.onJobComplete(snapshot, result));
    if (sessionComplete) {
      SessionResult merged = result();
      log.info("Session {} completed with {} job(s)", id, snapshot.jobs().size());
      for (ResearchDocumentSink sink : sinks) {
        notifyListener(() -> sink.complete(merged));
      }
      notifyListener(() -> listener.onSessionComplete(merged));
    } else if (snapshot.status() == SessionStatus.ERROR) {
      notifyListener(() -> listener.onSessionError(snapshot));
    }
  }

  @Override
  public void onError(JobFailure failure) {
    SessionSnapshot snapshot;
    synchronized (this) {
      TrackedJob tracked = jobs.get(failure.jobId());
      if (tracked == null || tracked.status.isTerminal()) {
        return;
      }
      tracked.status = JobStatus.FAILED;
      tracked.failure = failure;
      tracked.statusMessage = failure.message();
      updateTerminalStatus();
      snapshot = snapshot();
    }
    log.warn(
        "Session {} job {} failed ({}, retryable={}): {}",
        id,
        failure.jobId(),
        failure.kind(),
        failure.retryable(),
        failure.message());
    publishProgress(snapshot);
    notifyListener(() -> listener.onJobError(snapshot, failure));
    if (snapshot.status() == SessionStatus.ERROR) {
      notifyListener(() -> listener.onSessionError(snapshot));
    }
  }

  /**
   * Reset every retryable failed job to progress 0 so it can be resubmitted.
   *
   * @return the jobs to resubmit, in submission order
   */
  public synchronized List<ResearchJob> prepareRetry() {
    List<ResearchJob> retried = new ArrayList<>();
    for (TrackedJob tracked : jobs.values()) {
      if (tracked.status == JobStatus.FAILED
          && tracked.failure != null
          && tracked.failure.retryable()) {
        tracked.status = JobStatus.PENDING;
        tracked.progress = 0;
        tracked.failure = null;
        tracked.statusMessage = "Retry scheduled";
        retried.add(tracked.job);
      }
    }
    if (!retried.isEmpty() && status == SessionStatus.ERROR) {
      status = SessionStatus.RUNNING;
      finishedAt = null;
    }
    return retried;
  }

  /**
   * Mark a job cancelled. Has no effect on terminal jobs.
   *
   * @return true if the job was still pending or running
   */
  public synchronized boolean markCancelled(String jobId) {
    TrackedJob tracked = jobs.get(jobId);
    if (tracked == null || tracked.status.isTerminal()) {
      return false;
    }
    tracked.status = JobStatus.CANCELLED;
    tracked.statusMessage = "Cancelled";
    updateTerminalStatus();
    return true;
  }

  /**
   * Cancel the whole session.
   *
   * @return ids of the jobs that were still pending or running
   */
  public synchronized List<String> cancel() {
    List<String> cancelled = new ArrayList<>();
    for (TrackedJob tracked : jobs.values()) {
      if (!tracked.status.isTerminal()) {
        tracked.status = JobStatus.CANCELLED;
        tracked.statusMessage = "Cancelled";
        cancelled.add(tracked.job.id());
      }
    }
    if (status == SessionStatus.RUNNING) {
      status = SessionStatus.CANCELLED;
      finishedAt = clock.instant();
    }
    return cancelled;
  }

  private void updateTerminalStatus() {
    if (status != SessionStatus.RUNNING) {
      return;
    }
    boolean allTerminal = jobs.values().stream().allMatch(job -> job.status.isTerminal());
    if (!allTerminal) {
      return;
    }
    boolean anyFailed = jobs.values().stream().anyMatch(job -> job.status == JobStatus.FAILED);
    status = anyFailed ? SessionStatus.ERROR : SessionStatus.CANCELLED;
    finishedAt = clock.instant();
  }

  private double computeOverallProgress() {
    double mean = jobs.values().stream().mapToInt(job -> job.progress).average().orElse(0);
    return Math.min(100.0, Math.max(0.0, mean));
  }

  private void publishProgress(SessionSnapshot snapshot) {
    for (ResearchDocumentSink sink : sinks) {
      notifyListener(() -> sink.progress(snapshot));
    }
  }

  private void notifyListener(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      log.warn("Session {} listener threw; ignoring", id, e);
    }
  }

  private static int clamp(int progress) {
    return Math.min(100, Math.max(0, progress));
  }

  private static final class TrackedJob {
    private final ResearchJob job;
    private JobStatus status = JobStatus.PENDING;
    private int progress;
    private @Nullable String statusMessage;
    private @Nullable JobFailure failure;

    private TrackedJob(ResearchJob job) {
      this.job = job;
    }
  }
}

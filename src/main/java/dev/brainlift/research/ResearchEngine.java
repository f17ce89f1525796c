package dev.brainlift.research;

import java.util.Collection;
import java.util.List;

/**
 * Executes research jobs concurrently and reports their lifecycle through {@link JobListener}s.
 *
 * <p>Implementations never block the submitting thread, retry transient failures with backoff,
 * enforce a per-job deadline and stop delivering callbacks for a job once it is cancelled.
 */
public interface ResearchEngine {

  /**
   * Start the job on an idle slot or queue it behind earlier submissions.
   *
   * @param job the job to run
   * @param listener receives progress, results and failures for this job
   * @throws IllegalStateException if the engine has been shut down
   */
  void submit(ResearchJob job, JobListener listener);

  /** Submit every job in order with a shared listener. */
  default void submitParallelJobs(List<ResearchJob> jobs, JobListener listener) {
    for (ResearchJob job : jobs) {
      submit(job, listener);
    }
  }

  /**
   * Cancel a queued, backing-off or running job. No callback fires for it afterwards.
   *
   * @return true if the job was known to the engine
   */
  boolean cancelJob(String jobId);

  /**
   * Cancel several jobs as one operation. Jobs still waiting for a slot are removed before any
   * running job gives its slot up, so none of the given jobs starts because of this call.
   *
   * @return ids of the jobs that were known to the engine
   */
  List<String> cancelJobs(Collection<String> jobIds);

  List<WorkerStatus> getWorkerStatuses();

  /** Cancel everything and release all threads. Idempotent. */
  void shutdown();
}

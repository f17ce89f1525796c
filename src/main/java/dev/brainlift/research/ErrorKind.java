package dev.brainlift.research;

/** Classification of a job failure as reported to listeners. */
public enum ErrorKind {
  /** Timeout, rate limit or 5xx from a collaborator. Retried with backoff. */
  TRANSIENT,
  /** The job exceeded its wall-clock deadline. */
  TIMEOUT,
  /** Zero usable sources or malformed input. Never retried. */
  PERMANENT,
  /** A collaborator's hard request budget is exhausted. */
  QUOTA_EXCEEDED,
  /** The worker executing the job failed abnormally. */
  WORKER_CRASH
}

package dev.brainlift.session;

import dev.brainlift.research.JobFailure;
import dev.brainlift.research.JobProgress;
import dev.brainlift.research.JobResult;

/** Session-level callbacks. Every method has a no-op default. */
public interface SessionListener {

  SessionListener NONE = new SessionListener() {};

  default void onJobProgress(SessionSnapshot snapshot, JobProgress progress) {}

  default void onJobComplete(SessionSnapshot snapshot, JobResult result) {}

  default void onJobError(SessionSnapshot snapshot, JobFailure failure) {}

  /** Fires exactly once, when the last job of the session completes successfully. */
  default void onSessionComplete(SessionResult result) {}

  /** Fires when every job is terminal and at least one of them failed. */
  default void onSessionError(SessionSnapshot snapshot) {}
}

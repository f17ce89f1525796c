package dev.brainlift.session;

import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable view of a session, handed to listeners and the document sink.
 *
 * @param sessionId session identifier
 * @param documentId document the session researches for
 * @param status aggregate status
 * @param overallProgress mean of the per-job progress values, in [0, 100]
 * @param jobs per-job state in submission order
 * @param createdAt when the session started
 * @param finishedAt when the session reached a terminal status
 */
public record SessionSnapshot(
    String sessionId,
    String documentId,
    SessionStatus status,
    double overallProgress,
    List<JobSnapshot> jobs,
    Instant createdAt,
    @Nullable Instant finishedAt) {

  public SessionSnapshot {
    jobs = List.copyOf(jobs);
  }
}

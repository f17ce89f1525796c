package dev.brainlift.session;

import dev.brainlift.pipeline.QueryPlanner;
import dev.brainlift.research.ResearchCategory;
import dev.brainlift.research.ResearchEngine;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.ResearchRequirements;
import dev.brainlift.research.WorkerStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Caller-facing entry point: creates research sessions, submits their jobs to the configured
 * {@link ResearchEngine} and exposes retry, cancellation and status queries.
 *
 * <p>Sessions are held in memory only. Finished sessions are evicted lazily once they are older
 * than {@code brainlift.research.session-retention}.
 */
@Service
public class ResearchSessionService {

  private static final Logger log = LoggerFactory.getLogger(ResearchSessionService.class);

  private final ResearchEngine engine;
  private final QueryPlanner queryPlanner;
  private final List<ResearchDocumentSink> sinks;
  private final ResearchSessionProperties properties;
  private final Clock clock;
  private final Map<String, ResearchSession> sessions = new ConcurrentHashMap<>();

  public ResearchSessionService(
      ResearchEngine engine,
      QueryPlanner queryPlanner,
      List<ResearchDocumentSink> sinks,
      ResearchSessionProperties properties,
      Clock clock) {
    this.engine = engine;
    this.queryPlanner = queryPlanner;
    this.sinks = List.copyOf(sinks);
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Start one job per category for a document, with queries planned from the purpose.
   *
   * @param documentId document the research is for
   * @param purpose the document's purpose statement
   * @param categories categories to research; empty means all of them
   * @param requirements source requirements shared by every job
   * @param listener session callbacks
   * @return the running session
   */
  public ResearchSession startSession(
      String documentId,
      String purpose,
      Collection<ResearchCategory> categories,
      ResearchRequirements requirements,
      SessionListener listener) {
    if (purpose == null || purpose.isBlank()) {
      throw new IllegalArgumentException("Purpose must not be blank");
    }
    String sessionId = UUID.randomUUID().toString();
    EnumSet<ResearchCategory> selected =
        categories == null || categories.isEmpty()
            ? EnumSet.allOf(ResearchCategory.class)
            : EnumSet.copyOf(categories);

    List<ResearchJob> jobs = new ArrayList<>();
    for (ResearchCategory category : selected) {
      jobs.add(
          new ResearchJob(
              sessionId + "-" + category.key(),
              category,
              queryPlanner.planQueries(category, purpose),
              purpose,
              requirements));
    }
    return submit(sessionId, documentId, jobs, listener);
  }

  /**
   * Submit caller-built jobs as one session.
   *
   * @param documentId document the research is for
   * @param jobs jobs to run; ids must be unique
   * @param listener session callbacks
   * @return the running session
   */
  public ResearchSession submitParallelJobs(
      String documentId, List<ResearchJob> jobs, SessionListener listener) {
    return submit(UUID.randomUUID().toString(), documentId, jobs, listener);
  }

  /**
   * Resubmit every retryable failed job of a session from progress 0.
   *
   * @return ids of the resubmitted jobs
   * @throws SessionNotFoundException if the session is unknown or evicted
   */
  public List<String> retryFailedJobs(String sessionId) {
    ResearchSession session = requireSession(sessionId);
    List<ResearchJob> retried = session.prepareRetry();
    if (!retried.isEmpty()) {
      log.info("Session {}: retrying {} failed job(s)", sessionId, retried.size());
      engine.submitParallelJobs(retried, session);
    }
    return retried.stream().map(ResearchJob::id).toList();
  }

  /** Resubmit retryable failed jobs of every live session. */
  public List<String> retryFailedJobs() {
    List<String> retried = new ArrayList<>();
    for (String sessionId : List.copyOf(sessions.keySet())) {
      retried.addAll(retryFailedJobs(sessionId));
    }
    return retried;
  }

  /**
   * Cancel a single job. No further callbacks fire for it.
   *
   * @return true if the engine knew the job
   */
  public boolean cancelJob(String jobId) {
    boolean cancelled = engine.cancelJob(jobId);
    sessions.values().stream()
        .filter(session -> session.containsJob(jobId))
        .findFirst()
        .ifPresent(session -> session.markCancelled(jobId));
    return cancelled;
  }

  /**
   * Cancel every unfinished job of a session.
   *
   * @return ids of the jobs that were cancelled
   */
  public List<String> cancelSession(String sessionId) {
    ResearchSession session = requireSession(sessionId);
    List<String> cancelled = session.cancel();
    engine.cancelJobs(cancelled);
    log.info("Session {} cancelled ({} job(s) stopped)", sessionId, cancelled.size());
    return cancelled;
  }

  public SessionSnapshot getSession(String sessionId) {
    return requireSession(sessionId).snapshot();
  }

  public Optional<ResearchSession> findSession(String sessionId) {
    evictExpired();
    return Optional.ofNullable(sessions.get(sessionId));
  }

  public List<SessionSnapshot> listSessions() {
    evictExpired();
    return sessions.values().stream().map(ResearchSession::snapshot).toList();
  }

  public List<WorkerStatus> getWorkerStatuses() {
    return engine.getWorkerStatuses();
  }

  public void shutdown() {
    engine.shutdown();
  }

  private ResearchSession submit(
      String sessionId, String documentId, List<ResearchJob> jobs, SessionListener listener) {
    evictExpired();
    ResearchSession session =
        new ResearchSession(
            sessionId,
            documentId,
            jobs,
            listener == null ? SessionListener.NONE : listener,
            sinks,
            clock);
    sessions.put(sessionId, session);
    log.info(
        "Session {} for document {}: submitting {} job(s)", sessionId, documentId, jobs.size());
    try {
      engine.submitParallelJobs(jobs, session);
    } catch (RuntimeException e) {
      sessions.remove(sessionId);
      throw e;
    }
    return session;
  }

  private ResearchSession requireSession(String sessionId) {
    return findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  private void evictExpired() {
    Instant cutoff = clock.instant().minus(properties.sessionRetention());
    sessions
        .values()
        .removeIf(
            session -> {
              Optional<Instant> finished = session.finishedAt();
              return finished.isPresent() && finished.get().isBefore(cutoff);
            });
  }
}

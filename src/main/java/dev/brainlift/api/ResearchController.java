package dev.brainlift.api;

import dev.brainlift.research.ResearchCategory;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.WorkerStatus;
import dev.brainlift.session.ResearchSession;
import dev.brainlift.session.ResearchSessionService;
import dev.brainlift.session.SessionListener;
import dev.brainlift.session.SessionNotFoundException;
import dev.brainlift.session.SessionResult;
import dev.brainlift.session.SessionSnapshot;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP adapter over {@link ResearchSessionService}. Sessions run asynchronously; callers poll
 * {@code GET /api/research/sessions/{id}} for progress.
 */
@RestController
@RequestMapping("/api/research")
public class ResearchController {

  private final ResearchSessionService sessionService;

  public ResearchController(ResearchSessionService sessionService) {
    this.sessionService = sessionService;
  }

  @PostMapping("/sessions")
  public ResponseEntity<SessionSnapshot> startSession(@RequestBody StartSessionRequest request) {
    List<ResearchCategory> categories =
        request.categories() == null
            ? List.of()
            : request.categories().stream().map(ResearchCategory::fromKey).toList();
    ResearchSession session =
        sessionService.startSession(
            request.documentId(),
            request.purpose(),
            categories,
            RequirementsRequest.toRequirements(request.requirements()),
            SessionListener.NONE);
    return ResponseEntity.status(HttpStatus.CREATED).body(session.snapshot());
  }

  @PostMapping("/sessions/jobs")
  public ResponseEntity<SessionSnapshot> submitJobs(@RequestBody SubmitJobsRequest request) {
    if (request.jobs() == null || request.jobs().isEmpty()) {
      throw new IllegalArgumentException("At least one job is required");
    }
    List<ResearchJob> jobs =
        request.jobs().stream()
            .map(
                job ->
                    new ResearchJob(
                        job.id(),
                        ResearchCategory.fromKey(job.category()),
                        job.queries(),
                        job.purpose(),
                        RequirementsRequest.toRequirements(job.requirements())))
            .toList();
    ResearchSession session =
        sessionService.submitParallelJobs(request.documentId(), jobs, SessionListener.NONE);
    return ResponseEntity.status(HttpStatus.CREATED).body(session.snapshot());
  }

  @GetMapping("/sessions")
  public List<SessionSnapshot> listSessions() {
    return sessionService.listSessions();
  }

  @GetMapping("/sessions/{sessionId}")
  public SessionSnapshot getSession(@PathVariable String sessionId) {
    return sessionService.getSession(sessionId);
  }

  /** Results merged so far; complete once the session status is {@code COMPLETED}. */
  @GetMapping("/sessions/{sessionId}/result")
  public SessionResult getResult(@PathVariable String sessionId) {
    return sessionService
        .findSession(sessionId)
        .map(ResearchSession::result)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  @PostMapping("/sessions/{sessionId}/retry")
  public Map<String, List<String>> retryFailedJobs(@PathVariable String sessionId) {
    return Map.of("retriedJobIds", sessionService.retryFailedJobs(sessionId));
  }

  @PostMapping("/sessions/{sessionId}/cancel")
  public Map<String, List<String>> cancelSession(@PathVariable String sessionId) {
    return Map.of("cancelledJobIds", sessionService.cancelSession(sessionId));
  }

  @DeleteMapping("/jobs/{jobId}")
  public ResponseEntity<Void> cancelJob(@PathVariable String jobId) {
    return sessionService.cancelJob(jobId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @GetMapping("/workers")
  public List<WorkerStatus> workers() {
    return sessionService.getWorkerStatuses();
  }
}

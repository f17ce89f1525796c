package dev.brainlift.session;

/** The session id is unknown, or the session was evicted after its retention period. */
public class SessionNotFoundException extends RuntimeException {

  private final String sessionId;

  public SessionNotFoundException(String sessionId) {
    super("No research session with id " + sessionId);
    this.sessionId = sessionId;
  }

  public String sessionId() {
    return sessionId;
  }
}

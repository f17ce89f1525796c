package dev.brainlift.session;

/**
 * Consumer of session output, typically the document persistence layer. Calls are fire-and-forget:
 * the engine neither waits for nor inspects the outcome.
 */
public interface ResearchDocumentSink {

  void progress(SessionSnapshot snapshot);

  void complete(SessionResult result);
}

package dev.brainlift.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Records session output in the log. Other sinks, such as a document store, run alongside it. */
@Component
public class LoggingDocumentSink implements ResearchDocumentSink {

  private static final Logger log = LoggerFactory.getLogger(LoggingDocumentSink.class);

  @Override
  public void progress(SessionSnapshot snapshot) {
    log.debug(
        "Document {} session {}: {} at {}%",
        snapshot.documentId(),
        snapshot.sessionId(),
        snapshot.status(),
        Math.round(snapshot.overallProgress()));
  }

  @Override
  public void complete(SessionResult result) {
    result
        .resultsByCategory()
        .forEach(
            (category, results) ->
                log.info(
                    "Document {} section {}: {} result(s), {} source(s)",
                    result.documentId(),
                    category.sectionTitle(),
                    results.size(),
                    results.stream().mapToInt(r -> r.sources().size()).sum()));
  }
}

package dev.brainlift.research;

/**
 * Base of the research error taxonomy. Every failure a pipeline raises on purpose is one of its
 * subclasses; anything else escaping a worker is treated as a worker crash.
 */
public abstract class ResearchException extends RuntimeException {

  protected ResearchException(String message) {
    super(message);
  }

  protected ResearchException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind kind();

  public boolean retryable() {
    return kind() == ErrorKind.TRANSIENT;
  }
}

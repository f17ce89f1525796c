package dev.brainlift.research;

/** A collaborator call failed in a way that may succeed on retry. */
public class TransientServiceException extends ResearchException {

  public TransientServiceException(String message) {
    super(message);
  }

  public TransientServiceException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.TRANSIENT;
  }
}

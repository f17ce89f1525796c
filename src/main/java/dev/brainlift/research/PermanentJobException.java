package dev.brainlift.research;

/** The job cannot succeed no matter how often it is retried. */
public class PermanentJobException extends ResearchException {

  public PermanentJobException(String message) {
    super(message);
  }

  public PermanentJobException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.PERMANENT;
  }
}

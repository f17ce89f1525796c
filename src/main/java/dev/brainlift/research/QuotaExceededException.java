package dev.brainlift.research;

/**
 * A collaborator's hard request budget is spent. Distinct from throttling: waiting does not help
 * until the budget resets.
 */
public class QuotaExceededException extends ResearchException {

  public QuotaExceededException(String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.QUOTA_EXCEEDED;
  }
}

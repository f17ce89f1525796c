package dev.brainlift.session;

public enum SessionStatus {
  RUNNING,
  /** Every job completed successfully. */
  COMPLETED,
  /** Every job is terminal and at least one failed. */
  ERROR,
  CANCELLED
}

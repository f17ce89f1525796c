package dev.brainlift.research;

public enum WorkerState {
  IDLE,
  BUSY,
  /** Waiting to be respawned after a crash or timeout. */
  ERROR,
  /** Permanently removed from the pool after too many failures. */
  RETIRED
}

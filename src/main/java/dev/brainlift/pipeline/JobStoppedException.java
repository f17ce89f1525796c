package dev.brainlift.pipeline;

/** Unwinds a pipeline whose execution was cancelled or timed out. */
public class JobStoppedException extends RuntimeException {

  public JobStoppedException() {
    super("Job execution was stopped");
  }
}

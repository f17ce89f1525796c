package dev.brainlift.pipeline;

import dev.brainlift.research.Source;
import java.util.List;

/** The pipeline's only channel back to the engine running it. */
public interface PipelineContext {

  /** Identifier of the slot or branch executing the job. */
  String workerId();

  /** Report a checkpoint. Values lower than an earlier report are ignored by the engines. */
  void reportProgress(int progress, String status);

  /** Publish the sources selected by the analysis stage. */
  void reportPartialResult(List<Source> sources);

  boolean isStopped();

  /**
   * @throws JobStoppedException if the engine asked this execution to stop
   */
  default void checkNotStopped() {
    if (isStopped() || Thread.currentThread().isInterrupted()) {
      throw new JobStoppedException();
    }
  }
}

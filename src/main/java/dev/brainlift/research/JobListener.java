package dev.brainlift.research;

import java.util.List;
import java.util.function.Consumer;

/**
 * Callbacks for the lifecycle of a submitted job. Engines invoke them serially for a given job and
 * never after the job was cancelled.
 */
public interface JobListener {

  default void onProgress(JobProgress progress) {}

  /** Sources selected by the analysis stage, delivered before content generation. */
  default void onPartialResult(String jobId, List<Source> sources) {}

  default void onComplete(JobResult result) {}

  default void onError(JobFailure failure) {}

  static JobListener of(
      Consumer<JobProgress> onProgress,
      Consumer<JobResult> onComplete,
      Consumer<JobFailure> onError) {
    return new JobListener() {
      @Override
      public void onProgress(JobProgress progress) {
        onProgress.accept(progress);
      }

      @Override
      public void onComplete(JobResult result) {
        onComplete.accept(result);
      }

      @Override
      public void onError(JobFailure failure) {
        onError.accept(failure);
      }
    };
  }
}

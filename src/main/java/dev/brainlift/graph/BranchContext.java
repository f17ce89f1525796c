package dev.brainlift.graph;

import dev.brainlift.pipeline.PipelineContext;
import dev.brainlift.research.Source;
import java.util.List;

/** Pipeline context for one attempt of one branch. Reports go through the owning handle. */
final class BranchContext implements PipelineContext {

  private final BranchHandle handle;
  private final String workerId;
  private volatile boolean stopped;

  BranchContext(BranchHandle handle, String workerId) {
    this.handle = handle;
    this.workerId = workerId;
  }

  @Override
  public String workerId() {
    return workerId;
  }

  @Override
  public void reportProgress(int progress, String status) {
    if (!stopped) {
      handle.progress(this, progress, status);
    }
  }

  @Override
  public void reportPartialResult(List<Source> sources) {
    if (!stopped) {
      handle.partialResult(this, List.copyOf(sources));
    }
  }

  @Override
  public boolean isStopped() {
    return stopped;
  }

  void stop() {
    stopped = true;
  }
}

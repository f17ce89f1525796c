package dev.brainlift.fixture;

import dev.brainlift.pipeline.JobStoppedException;
import dev.brainlift.pipeline.PipelineContext;
import dev.brainlift.pipeline.ResearchPipeline;
import dev.brainlift.research.JobMetadata;
import dev.brainlift.research.JobResult;
import dev.brainlift.research.ResearchJob;
import dev.brainlift.research.Source;
import dev.brainlift.research.SourceType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic {@link ResearchPipeline} test double. By default a job reports 10, 25, 50, 75 and
 * 100 and returns one source. Jobs can be scripted to fail, to block until released, or to hang
 * until the engine stops them.
 */
public final class ScriptedPipeline implements ResearchPipeline {

  private final Map<String, Deque<RuntimeException>> failures = new ConcurrentHashMap<>();
  private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
  private final Set<String> hanging = ConcurrentHashMap.newKeySet();
  private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
  private final List<String> started = new CopyOnWriteArrayList<>();
  private final List<String> stopped = new CopyOnWriteArrayList<>();

  /** Successive executions of the job throw these errors, then the job succeeds. */
  public ScriptedPipeline failWith(String jobId, RuntimeException... errors) {
    failures.put(jobId, new ArrayDeque<>(List.of(errors)));
    return this;
  }

  /** Executions of the job block after the first checkpoint until {@link #release}. */
  public ScriptedPipeline hold(String... jobIds) {
    for (String jobId : jobIds) {
      gates.put(jobId, new CountDownLatch(1));
    }
    return this;
  }

  public void release(String jobId) {
    CountDownLatch gate = gates.get(jobId);
    if (gate != null) {
      gate.countDown();
    }
  }

  /** Executions of the job never finish on their own. */
  public ScriptedPipeline hang(String jobId) {
    hanging.add(jobId);
    return this;
  }

  /** Job ids in the order their executions started, one entry per attempt. */
  public List<String> started() {
    return started;
  }

  /** Job ids whose execution observed a stop request. */
  public List<String> stopped() {
    return stopped;
  }

  public int attempts(String jobId) {
    AtomicInteger count = attempts.get(jobId);
    return count == null ? 0 : count.get();
  }

  @Override
  public JobResult execute(ResearchJob job, PipelineContext context) {
    started.add(job.id());
    attempts.computeIfAbsent(job.id(), id -> new AtomicInteger()).incrementAndGet();
    context.reportProgress(10, "Starting");

    Deque<RuntimeException> scripted = failures.get(job.id());
    if (scripted != null) {
      RuntimeException next;
      synchronized (scripted) {
        next = scripted.poll();
      }
      if (next != null) {
        throw next;
      }
    }
    if (hanging.contains(job.id())) {
      waitUntilStopped(job, context);
    }
    CountDownLatch gate = gates.get(job.id());
    if (gate != null) {
      try {
        gate.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stopped.add(job.id());
        throw new JobStoppedException();
      }
    }

    context.reportProgress(25, "Searching for sources");
    context.reportProgress(50, "Analyzing sources");
    List<Source> sources = List.of(source(job));
    context.reportPartialResult(sources);
    context.reportProgress(75, "Generating content");
    context.reportProgress(100, "Research complete");
    return new JobResult(
        job.id(),
        context.workerId(),
        job.category(),
        sources,
        "Analysis based on 1 sources.",
        "## " + job.category().sectionTitle(),
        false,
        new JobMetadata(1, 1, 2, 7.0));
  }

  private void waitUntilStopped(ResearchJob job, PipelineContext context) {
    try {
      while (!context.isStopped()) {
        Thread.sleep(5);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    stopped.add(job.id());
    throw new JobStoppedException();
  }

  private static Source source(ResearchJob job) {
    return new Source(
        job.id() + "-src-1",
        "https://example.org/" + job.id(),
        "Source for " + job.id(),
        null,
        null,
        SourceType.OTHER,
        7.0,
        6.0,
        List.of(),
        "summary");
  }
}

package dev.brainlift.session;

import static org.assertj.core.api.Assertions.assertThat;

import dev.brainlift.fixture.ResearchJobBuilder;
import dev.brainlift.research.JobProgress;
import dev.brainlift.research.ResearchJob;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

class ResearchSessionProgressPropertyTest {

  private static final int JOBS = 3;

  @Property
  void overallProgressIsTheMeanOfEachJobsHighestReport(
      @ForAll @Size(max = 40) List<@IntRange(min = -50, max = 150) Integer> reports) {
    List<ResearchJob> jobs = ResearchJobBuilder.jobs(JOBS);
    ResearchSession session =
        new ResearchSession(
            "session-1", "doc-1", jobs, SessionListener.NONE, List.of(), Clock.systemUTC());
    int[] highest = new int[JOBS];

    for (int i = 0; i < reports.size(); i++) {
      int job = i % JOBS;
      int reported = reports.get(i);
      session.onProgress(
          new JobProgress(jobs.get(job).id(), "worker-1", reported, "Working", Instant.EPOCH, null));
      highest[job] = Math.max(highest[job], Math.min(100, Math.max(0, reported)));

      double expected = (highest[0] + highest[1] + highest[2]) / (double) JOBS;
      assertThat(session.overallProgress()).isEqualTo(expected).isBetween(0.0, 100.0);
    }
  }

  @Property
  void jobProgressIsMonotonic(
      @ForAll @Size(max = 30) List<@IntRange(min = 0, max = 100) Integer> reports) {
    ResearchJob job = new ResearchJobBuilder().id("job-1").build();
    ResearchSession session =
        new ResearchSession(
            "session-1", "doc-1", List.of(job), SessionListener.NONE, List.of(), Clock.systemUTC());
    int previous = 0;

    for (int reported : reports) {
      session.onProgress(new JobProgress("job-1", "worker-1", reported, "Working", Instant.EPOCH, null));
      int current = session.snapshot().jobs().get(0).progress();
      assertThat(current).isGreaterThanOrEqualTo(previous);
      previous = current;
    }
  }
}

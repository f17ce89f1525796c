package dev.brainlift.research;

/**
 * Timing and cost figures collected while running a job.
 *
 * @param searchTimeMs wall time spent in the search stage
 * @param analysisTimeMs wall time spent scoring sources and generating content
 * @param apiCallCount number of external calls issued by the job
 * @param overallCredibility mean credibility of the selected sources, 0 when there are none
 */
public record JobMetadata(
    long searchTimeMs, long analysisTimeMs, int apiCallCount, double overallCredibility) {}

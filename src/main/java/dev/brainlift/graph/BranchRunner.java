package dev.brainlift.graph;

import dev.brainlift.research.ResearchJob;

/** Executes the research pipeline for one branch of the workflow. */
@FunctionalInterface
public interface BranchRunner {

  StateUpdate<ResearchGraphState> run(ResearchJob job);
}

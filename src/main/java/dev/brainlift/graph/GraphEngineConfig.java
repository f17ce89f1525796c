package dev.brainlift.graph;

import dev.brainlift.pipeline.QueryPlanner;
import dev.brainlift.pipeline.ResearchPipeline;
import dev.brainlift.worker.WorkerPoolProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the workflow-graph engine with {@code brainlift.research.engine=graph}. */
@Configuration
@ConditionalOnProperty(name = "brainlift.research.engine", havingValue = "graph")
public class GraphEngineConfig {

  @Bean
  public ResearchGraphFactory researchGraphFactory(QueryPlanner queryPlanner) {
    return new ResearchGraphFactory(queryPlanner);
  }

  @Bean(destroyMethod = "shutdown")
  public GraphResearchEngine graphResearchEngine(
      ResearchGraphFactory researchGraphFactory,
      ResearchPipeline pipeline,
      WorkerPoolProperties properties,
      Clock clock) {
    return new GraphResearchEngine(researchGraphFactory, pipeline, properties, clock);
  }
}

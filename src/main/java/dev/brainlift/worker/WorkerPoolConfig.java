package dev.brainlift.worker;

import dev.brainlift.pipeline.ResearchPipeline;
import dev.brainlift.research.ResearchEngine;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Registers the worker pool as the {@link ResearchEngine} unless the graph engine is selected. */
@Configuration
@ConditionalOnProperty(name = "brainlift.research.engine", havingValue = "pool", matchIfMissing = true)
public class WorkerPoolConfig {

    @Bean(destroyMethod = "shutdown")
    public WorkerPoolManager workerPoolManager(ResearchPipeline pipeline, WorkerPoolProperties properties,
                                               Clock clock) {
        return new WorkerPoolManager(pipeline, properties, clock);
    }
}

package dev.brainlift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the research orchestration service.
 *
 * <p>The execution engine is chosen with {@code brainlift.research.engine}: {@code pool} (default)
 * runs jobs on the worker pool manager, {@code graph} runs them through the workflow graph.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class BrainliftResearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(BrainliftResearchApplication.class, args);
    }
}

package dev.brainlift.worker;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Worker pool settings bound from {@code brainlift.worker.*}.
 *
 * @param poolSize number of execution slots
 * @param maxWorkerFailures crashes or timeouts after which a slot is retired
 * @param jobTimeout wall-clock deadline per job execution
 * @param respawnDelay pause before a failed slot accepts work again
 * @param maxRetries automatic retries of a transiently failing job
 * @param initialBackoff delay before the first retry
 * @param backoffMultiplier growth factor between consecutive retry delays
 * @param maxBackoff upper bound for a single retry delay
 */
@ConfigurationProperties(prefix = "brainlift.worker")
public record WorkerPoolProperties(
        int poolSize,
        int maxWorkerFailures,
        Duration jobTimeout,
        Duration respawnDelay,
        int maxRetries,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration maxBackoff
) {

    public WorkerPoolProperties {
        poolSize = poolSize <= 0 ? 3 : poolSize;
        maxWorkerFailures = maxWorkerFailures <= 0 ? 3 : maxWorkerFailures;
        jobTimeout = jobTimeout == null ? Duration.ofMinutes(5) : jobTimeout;
        respawnDelay = respawnDelay == null ? Duration.ofSeconds(5) : respawnDelay;
        maxRetries = Math.max(0, maxRetries);
        initialBackoff = initialBackoff == null ? Duration.ofSeconds(2) : initialBackoff;
        backoffMultiplier = backoffMultiplier < 1.0 ? 2.0 : backoffMultiplier;
        maxBackoff = maxBackoff == null ? Duration.ofMinutes(1) : maxBackoff;
    }

    public static WorkerPoolProperties defaults() {
        return new WorkerPoolProperties(3, 3, null, null, 3, null, 2.0, null);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, initialBackoff, backoffMultiplier, maxBackoff);
    }
}

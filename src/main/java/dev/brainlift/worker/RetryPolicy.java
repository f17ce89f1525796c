package dev.brainlift.worker;

import java.time.Duration;

/**
 * Exponential backoff for retrying failed jobs, independent of worker failure counting.
 *
 * @param maxRetries retries allowed after the first execution
 * @param initialBackoff delay before the first retry
 * @param multiplier growth factor per retry
 * @param maxBackoff cap for a single delay
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
    }

    /** Whether a job that has already been retried {@code retriesSoFar} times may run again. */
    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry
     */
    public Duration backoffFor(int retry) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}

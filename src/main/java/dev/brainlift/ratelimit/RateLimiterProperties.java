package dev.brainlift.ratelimit;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bucket settings per external service, bound from {@code brainlift.rate-limit.*}. Any field left
 * unset falls back to that service's default.
 *
 * @param search limits for the web search collaborator
 * @param generation limits for the text generation collaborator
 */
@ConfigurationProperties(prefix = "brainlift.rate-limit")
public record RateLimiterProperties(@Nullable Bucket search, @Nullable Bucket generation) {

    static final Bucket SEARCH_DEFAULTS = new Bucket(5, 1.0, 1000L);
    static final Bucket GENERATION_DEFAULTS = new Bucket(3, 0.5, 500L);

    public RateLimiterProperties {
        search = search == null ? SEARCH_DEFAULTS : search.orElse(SEARCH_DEFAULTS);
        generation = generation == null ? GENERATION_DEFAULTS : generation.orElse(GENERATION_DEFAULTS);
    }

    /**
     * @param capacity maximum burst size
     * @param refillPerSecond continuous refill rate
     * @param dailyBudget hard cap of requests per UTC day, zero or less for unlimited
     */
    public record Bucket(@Nullable Integer capacity, @Nullable Double refillPerSecond, @Nullable Long dailyBudget) {
        public Bucket {
            if (capacity != null && capacity < 1) {
                throw new IllegalStateException(
                        "brainlift.rate-limit.*.capacity must be at least 1, got: " + capacity);
            }
            if (refillPerSecond != null && refillPerSecond <= 0.0) {
                throw new IllegalStateException(
                        "brainlift.rate-limit.*.refill-per-second must be positive, got: " + refillPerSecond);
            }
        }

        /** Fill every unset field from {@code defaults}. */
        Bucket orElse(Bucket defaults) {
            return new Bucket(
                    capacity == null ? defaults.capacity() : capacity,
                    refillPerSecond == null ? defaults.refillPerSecond() : refillPerSecond,
                    dailyBudget == null ? defaults.dailyBudget() : dailyBudget);
        }
    }
}

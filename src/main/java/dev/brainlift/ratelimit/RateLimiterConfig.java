package dev.brainlift.ratelimit;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One {@link TokenBucketRateLimiter} per external service. Collaborator clients inject them by
 * qualifier ({@code searchRateLimiter}, {@code generationRateLimiter}).
 */
@Configuration
public class RateLimiterConfig {

    @Bean
    public TokenBucketRateLimiter searchRateLimiter(RateLimiterProperties properties, Clock clock) {
        return create("search", properties.search(), clock);
    }

    @Bean
    public TokenBucketRateLimiter generationRateLimiter(RateLimiterProperties properties, Clock clock) {
        return create("generation", properties.generation(), clock);
    }

    private static TokenBucketRateLimiter create(String name, RateLimiterProperties.Bucket bucket, Clock clock) {
        return new TokenBucketRateLimiter(
                name, bucket.capacity(), bucket.refillPerSecond(), bucket.dailyBudget(), clock);
    }
}

package dev.brainlift.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.brainlift.fixture.MutableClock;
import dev.brainlift.research.QuotaExceededException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenBucketRateLimiterTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private Sleeper advancingSleeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        sleeps = new ArrayList<>();
        advancingSleeper = duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        };
    }

    @Test
    void burstUpToCapacityIsGrantedImmediately() throws InterruptedException {
        var limiter = new TokenBucketRateLimiter("search", 5, 1.0, 0, clock, advancingSleeper);

        for (int i = 0; i < 5; i++) {
            limiter.waitForToken();
        }

        assertThat(sleeps).isEmpty();
        assertThat(limiter.getRequestCount()).isEqualTo(5);
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void emptyBucketWaitsForRefill() throws InterruptedException {
        var limiter = new TokenBucketRateLimiter("generation", 1, 0.5, 0, clock, advancingSleeper);
        limiter.waitForToken();

        limiter.waitForToken();

        assertThat(sleeps).hasSize(1);
        assertThat(sleeps.get(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(limiter.getRequestCount()).isEqualTo(2);
    }

    @Test
    void tokensRefillContinuouslyUpToCapacity() {
        var limiter = new TokenBucketRateLimiter("search", 3, 1.0, 0, clock, advancingSleeper);
        limiter.tryAcquire();
        limiter.tryAcquire();
        limiter.tryAcquire();

        clock.advance(Duration.ofMillis(1500));
        assertThat(limiter.availableTokens()).isEqualTo(1.5);

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void exhaustedDailyBudgetThrowsQuotaExceeded() throws InterruptedException {
        var limiter = new TokenBucketRateLimiter("search", 10, 1.0, 2, clock, advancingSleeper);
        limiter.waitForToken();
        limiter.waitForToken();

        assertThat(limiter.remainingBudget()).isZero();
        assertThatThrownBy(limiter::waitForToken)
                .isInstanceOf(QuotaExceededException.class)
                .hasMessageContaining("search");
    }

    @Test
    void dailyBudgetResetsOnTheNextUtcDay() throws InterruptedException {
        var limiter = new TokenBucketRateLimiter("search", 10, 1.0, 1, clock, advancingSleeper);
        limiter.waitForToken();

        clock.set(Instant.parse("2025-03-11T00:00:01Z"));

        assertThat(limiter.remainingBudget()).isEqualTo(1);
        limiter.waitForToken();
        assertThat(limiter.getRequestCount()).isEqualTo(2);
    }

    @Test
    void unlimitedBudgetReportsMaxValue() {
        var limiter = new TokenBucketRateLimiter("search", 1, 1.0, 0, clock, advancingSleeper);

        assertThat(limiter.remainingBudget()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter("x", 0, 1.0, 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter("x", 1, 0.0, 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

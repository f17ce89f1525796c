package dev.brainlift.ratelimit;

import dev.brainlift.research.QuotaExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token bucket guarding calls to one external service.
 *
 * <p>Tokens refill continuously at {@code refillPerSecond} up to {@code capacity}. Independently, a
 * hard daily budget caps the number of granted tokens per UTC day; once it is spent every caller
 * gets a {@link QuotaExceededException} until the day rolls over. A budget of zero or less means
 * unlimited.
 *
 * <p>Thread-safe. Waiting callers sleep outside the lock, so a blocked worker only blocks itself.
 */
public class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final double refillPerSecond;
    private final long dailyBudget;
    private final Clock clock;
    private final Sleeper sleeper;

    private double tokens;
    private Instant lastRefill;
    private LocalDate budgetDay;
    private long usedToday;
    private long requestCount;

    public TokenBucketRateLimiter(String name, int capacity, double refillPerSecond, long dailyBudget,
                                  Clock clock, Sleeper sleeper) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got: " + capacity);
        }
        if (refillPerSecond <= 0.0) {
            throw new IllegalArgumentException("refillPerSecond must be positive, got: " + refillPerSecond);
        }
        this.name = name;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.dailyBudget = dailyBudget;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefill = clock.instant();
        this.budgetDay = today();
    }

    public TokenBucketRateLimiter(String name, int capacity, double refillPerSecond, long dailyBudget,
                                  Clock clock) {
        this(name, capacity, refillPerSecond, dailyBudget, clock, Sleeper.SYSTEM);
    }

    /**
     * Block until a token is available and take it.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws QuotaExceededException if today's budget is already spent
     */
    public void waitForToken() throws InterruptedException {
        while (true) {
            Duration wait;
            synchronized (this) {
                if (tryTake()) {
                    return;
                }
                wait = timeUntilNextToken();
            }
            log.debug("Rate limiter '{}' throttling for {} ms", name, wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    /**
     * Take a token if one is available right now.
     *
     * @return false when the bucket is empty
     * @throws QuotaExceededException if today's budget is already spent
     */
    public synchronized boolean tryAcquire() {
        return tryTake();
    }

    /** Tokens currently in the bucket, after refill. */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    /** Total tokens granted since creation. */
    public synchronized long getRequestCount() {
        return requestCount;
    }

    /** Tokens left in today's budget, or {@link Long#MAX_VALUE} when unlimited. */
    public synchronized long remainingBudget() {
        resetBudgetIfNewDay();
        return dailyBudget <= 0 ? Long.MAX_VALUE : Math.max(0, dailyBudget - usedToday);
    }

    public String name() {
        return name;
    }

    private boolean tryTake() {
        resetBudgetIfNewDay();
        if (dailyBudget > 0 && usedToday >= dailyBudget) {
            throw new QuotaExceededException(
                    "Daily request budget of " + dailyBudget + " exhausted for " + name);
        }
        refill();
        if (tokens < 1.0) {
            return false;
        }
        tokens -= 1.0;
        usedToday++;
        requestCount++;
        return true;
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        if (elapsedNanos > 0) {
            tokens = Math.min(capacity, tokens + elapsedNanos / 1_000_000_000.0 * refillPerSecond);
            lastRefill = now;
        }
    }

    private Duration timeUntilNextToken() {
        double missing = 1.0 - tokens;
        long nanos = (long) Math.ceil(missing / refillPerSecond * 1_000_000_000.0);
        return Duration.ofNanos(Math.max(nanos, 1_000_000L));
    }

    private void resetBudgetIfNewDay() {
        LocalDate today = today();
        if (!today.equals(budgetDay)) {
            budgetDay = today;
            usedToday = 0;
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}

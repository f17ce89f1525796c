package dev.brainlift.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Suspends the calling thread. Replaced in tests to advance a fake clock instead. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}

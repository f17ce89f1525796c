package dev.brainlift.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class RateLimiterPropertiesTest {

    private static RateLimiterProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("brainlift.rate-limit", RateLimiterProperties.class);
    }

    @Test
    void overridingOneFieldKeepsTheOtherDefaults() {
        RateLimiterProperties properties = bind(Map.of("brainlift.rate-limit.generation.capacity", "50"));

        assertThat(properties.generation()).isEqualTo(new RateLimiterProperties.Bucket(50, 0.5, 500L));
        assertThat(properties.search()).isEqualTo(RateLimiterProperties.SEARCH_DEFAULTS);
    }

    @Test
    void unsetBucketsUseServiceDefaults() {
        RateLimiterProperties properties = bind(Map.of());

        assertThat(properties.search()).isEqualTo(new RateLimiterProperties.Bucket(5, 1.0, 1000L));
        assertThat(properties.generation()).isEqualTo(new RateLimiterProperties.Bucket(3, 0.5, 500L));
    }

    @Test
    void explicitZeroDailyBudgetMeansUnlimited() {
        RateLimiterProperties properties = bind(Map.of("brainlift.rate-limit.search.daily-budget", "0"));

        assertThat(properties.search().dailyBudget()).isZero();
        assertThat(properties.search().capacity()).isEqualTo(5);
    }

    @Test
    void invalidRefillRateIsRejected() {
        assertThatThrownBy(() -> bind(Map.of("brainlift.rate-limit.search.refill-per-second", "0")))
                .isInstanceOf(BindException.class)
                .rootCause()
                .hasMessageContaining("refill-per-second must be positive");
    }
}

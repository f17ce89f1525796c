package dev.brainlift.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session settings bound from {@code brainlift.research.*}.
 *
 * @param engine execution engine, {@code pool} or {@code graph}
 * @param sessionRetention how long a finished session stays queryable
 */
@ConfigurationProperties(prefix = "brainlift.research")
public record ResearchSessionProperties(String engine, Duration sessionRetention) {

  public ResearchSessionProperties {
    engine = engine == null || engine.isBlank() ? "pool" : engine;
    if (!engine.equals("pool") && !engine.equals("graph")) {
      throw new IllegalStateException(
          "brainlift.research.engine must be 'pool' or 'graph', got: " + engine);
    }
    sessionRetention = sessionRetention == null ? Duration.ofMinutes(30) : sessionRetention;
  }
}

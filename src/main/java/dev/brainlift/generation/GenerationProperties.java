package dev.brainlift.generation;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Chat model settings bound from {@code brainlift.generation.*}. No chat model bean is created when
 * {@code api-key} is blank; generation then fails and jobs fall back to templated content.
 */
@ConfigurationProperties(prefix = "brainlift.generation")
public record GenerationProperties(String apiKey, String modelName, Duration timeout, Retry retry) {

  public GenerationProperties {
    apiKey = apiKey == null ? "" : apiKey.trim();
    modelName = modelName == null || modelName.isBlank() ? "gpt-4o-mini" : modelName;
    timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
    retry = retry == null ? new Retry(3, 1000, 2.0) : retry;
  }

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}

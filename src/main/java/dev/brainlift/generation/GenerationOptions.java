package dev.brainlift.generation;

/**
 * Sampling settings for one completion.
 *
 * @param temperature sampling temperature in [0, 2]
 * @param maxTokens maximum tokens in the completion
 * @param structuredOutput request a JSON object instead of free text
 */
public record GenerationOptions(double temperature, int maxTokens, boolean structuredOutput) {

  public GenerationOptions {
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalArgumentException("temperature must be in [0, 2], got: " + temperature);
    }
    if (maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be at least 1, got: " + maxTokens);
    }
  }

  public static GenerationOptions text(double temperature, int maxTokens) {
    return new GenerationOptions(temperature, maxTokens, false);
  }
}

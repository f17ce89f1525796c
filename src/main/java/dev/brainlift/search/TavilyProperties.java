package dev.brainlift.search;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "brainlift.tavily")
public record TavilyProperties(
    String baseUrl, String apiKey, int connectTimeoutMs, int readTimeoutMs, int maxResults) {

  public TavilyProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.tavily.com" : baseUrl;
    apiKey = apiKey == null ? "" : apiKey.trim();
    connectTimeoutMs = connectTimeoutMs <= 0 ? 5000 : connectTimeoutMs;
    readTimeoutMs = readTimeoutMs <= 0 ? 30000 : readTimeoutMs;
    maxResults = maxResults <= 0 ? 5 : maxResults;
  }

  public boolean hasApiKey() {
    return !apiKey.isEmpty();
  }
}

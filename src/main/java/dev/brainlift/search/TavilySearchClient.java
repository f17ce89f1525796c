package dev.brainlift.search;

import dev.brainlift.ratelimit.TokenBucketRateLimiter;
import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.QuotaExceededException;
import dev.brainlift.research.TransientServiceException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link SearchClient} backed by the Tavily search API.
 *
 * <p>Every call first takes a token from the search rate limiter. HTTP 429, 5xx and I/O failures
 * are transient; 432 and 433 (plan and usage limits) mean the quota is spent; any other 4xx is
 * permanent.
 */
@Service
public class TavilySearchClient implements SearchClient {

  private static final Logger log = LoggerFactory.getLogger(TavilySearchClient.class);

  private static final int TOO_MANY_REQUESTS = 429;
  private static final int PLAN_LIMIT_EXCEEDED = 432;
  private static final int USAGE_LIMIT_EXCEEDED = 433;

  private final RestClient restClient;
  private final TavilyProperties properties;
  private final TokenBucketRateLimiter rateLimiter;
  private final AtomicLong requestCount = new AtomicLong();

  public TavilySearchClient(
      @Qualifier("tavilyRestClient") RestClient restClient,
      TavilyProperties properties,
      @Qualifier("searchRateLimiter") TokenBucketRateLimiter rateLimiter) {
    this.restClient = restClient;
    this.properties = properties;
    this.rateLimiter = rateLimiter;
  }

  @Override
  public List<SearchHit> search(String query, SearchFilters filters) {
    if (!properties.hasApiKey()) {
      throw new PermanentJobException("Tavily API key is not configured");
    }
    acquireToken();
    requestCount.incrementAndGet();

    TavilyResponse response;
    try {
      response =
          restClient
              .post()
              .uri("/search")
              .body(TavilyRequest.of(query, filters))
              .retrieve()
              .body(TavilyResponse.class);
    } catch (RestClientResponseException e) {
      throw classify(query, e);
    } catch (ResourceAccessException e) {
      throw new TransientServiceException("Network error searching for '" + query + "'", e);
    } catch (RestClientException e) {
      throw new TransientServiceException(
          "Search request failed for '" + query + "': " + e.getMessage(), e);
    }

    if (response == null) {
      log.debug("Tavily returned an empty body for '{}'", query);
      return List.of();
    }
    return response.results().stream().map(TavilyResponse.Result::toHit).toList();
  }

  @Override
  public long requestCount() {
    return requestCount.get();
  }

  private void acquireToken() {
    try {
      rateLimiter.waitForToken();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientServiceException("Interrupted while waiting for a search token", e);
    }
  }

  private RuntimeException classify(String query, RestClientResponseException e) {
    int status = e.getStatusCode().value();
    String message = "Tavily returned HTTP " + status + " for '" + query + "'";
    if (status == PLAN_LIMIT_EXCEEDED || status == USAGE_LIMIT_EXCEEDED) {
      return new QuotaExceededException(message);
    }
    if (status == TOO_MANY_REQUESTS || e.getStatusCode().is5xxServerError()) {
      return new TransientServiceException(message, e);
    }
    return new PermanentJobException(message, e);
  }
}

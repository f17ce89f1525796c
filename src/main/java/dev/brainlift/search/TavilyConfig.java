package dev.brainlift.search;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the Tavily search API.
 *
 * <p>Timeouts and credentials come from {@code brainlift.tavily.*}. The client is qualified as
 * {@code "tavilyRestClient"}.
 */
@Configuration
public class TavilyConfig {

    /**
     * Creates a JSON {@link RestClient} targeting the Tavily API with bearer authentication.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties base URL, API key and timeouts
     * @return a named REST client bean for injection into {@link TavilySearchClient}
     */
    @Bean
    public RestClient tavilyRestClient(RestClient.Builder builder, TavilyProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        RestClient.Builder configured = builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (properties.hasApiKey()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
        }
        return configured.build();
    }
}

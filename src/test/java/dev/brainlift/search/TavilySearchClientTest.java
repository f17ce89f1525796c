package dev.brainlift.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.brainlift.ratelimit.TokenBucketRateLimiter;
import dev.brainlift.research.AnalysisDepth;
import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.QuotaExceededException;
import dev.brainlift.research.TransientServiceException;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class TavilySearchClientTest {

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private final SearchFilters filters =
      new SearchFilters(List.of("arxiv.org"), List.of("reddit.com"), AnalysisDepth.BASIC, 5);

  private TavilySearchClient client;

  @BeforeEach
  void setUp() {
    client = clientWithKey("tvly-test");
  }

  private TavilySearchClient clientWithKey(String apiKey) {
    return new TavilySearchClient(
        restClient,
        new TavilyProperties(null, apiKey, 0, 0, 0),
        new TokenBucketRateLimiter("search", 100, 10.0, 0, Clock.systemUTC()));
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/search")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(TavilyRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  @Test
  void searchMapsResultsToHits() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenReturn(
            new TavilyResponse(
                "raft",
                List.of(
                    new TavilyResponse.Result(
                        "In Search of an Understandable Consensus Algorithm",
                        "https://raft.github.io/raft.pdf",
                        "Raft is a consensus algorithm...",
                        0.92,
                        "2014-06-19",
                        "Diego Ongaro"))));

    List<SearchHit> hits = client.search("raft", filters);

    assertThat(hits).hasSize(1);
    SearchHit hit = hits.get(0);
    assertThat(hit.url()).isEqualTo("https://raft.github.io/raft.pdf");
    assertThat(hit.nativeScore()).isEqualTo(0.92);
    assertThat(hit.publishDate()).isEqualTo("2014-06-19");
    assertThat(hit.author()).isEqualTo("Diego Ongaro");
    assertThat(client.requestCount()).isEqualTo(1);
  }

  @Test
  void searchSendsFiltersInTheRequestBody() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class)).thenReturn(new TavilyResponse("q", List.of()));
    ArgumentCaptor<TavilyRequest> request = ArgumentCaptor.forClass(TavilyRequest.class);

    client.search("raft consensus", filters);

    verify(requestBodySpec).body(request.capture());
    assertThat(request.getValue().query()).isEqualTo("raft consensus");
    assertThat(request.getValue().search_depth()).isEqualTo("basic");
    assertThat(request.getValue().include_domains()).containsExactly("arxiv.org");
    assertThat(request.getValue().exclude_domains()).containsExactly("reddit.com");
    assertThat(request.getValue().max_results()).isEqualTo(5);
  }

  @Test
  void nullBodyReturnsNoHits() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class)).thenReturn(null);

    assertThat(client.search("raft", filters)).isEmpty();
  }

  @Test
  void nullContentBecomesEmptyString() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenReturn(
            new TavilyResponse(
                null,
                List.of(new TavilyResponse.Result("Title", "https://a.org", null, 0.5, null, null))));

    assertThat(client.search("raft", filters).get(0).content()).isEmpty();
  }

  @Test
  void tooManyRequestsIsTransient() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenThrow(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> client.search("raft", filters))
        .isInstanceOf(TransientServiceException.class)
        .hasMessageContaining("429");
  }

  @Test
  void serverErrorIsTransient() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenThrow(new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

    assertThatThrownBy(() -> client.search("raft", filters))
        .isInstanceOf(TransientServiceException.class);
  }

  @Test
  void usageLimitIsQuotaExceeded() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenThrow(new HttpClientErrorException(HttpStatusCode.valueOf(432)));

    assertThatThrownBy(() -> client.search("raft", filters))
        .isInstanceOf(QuotaExceededException.class);
  }

  @Test
  void badRequestIsPermanent() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenThrow(new HttpClientErrorException(HttpStatus.BAD_REQUEST));

    assertThatThrownBy(() -> client.search("raft", filters))
        .isInstanceOf(PermanentJobException.class);
  }

  @Test
  void networkErrorIsTransient() {
    stubRestClientChain();
    when(responseSpec.body(TavilyResponse.class))
        .thenThrow(new ResourceAccessException("Connection refused"));

    assertThatThrownBy(() -> client.search("raft", filters))
        .isInstanceOf(TransientServiceException.class)
        .hasMessageContaining("Network error");
  }

  @Test
  void missingApiKeyFailsPermanentlyWithoutCallingTavily() {
    TavilySearchClient unconfigured = clientWithKey("  ");

    assertThatThrownBy(() -> unconfigured.search("raft", filters))
        .isInstanceOf(PermanentJobException.class);
    verifyNoInteractions(restClient);
  }
}

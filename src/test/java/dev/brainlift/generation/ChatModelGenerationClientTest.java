package dev.brainlift.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.brainlift.ratelimit.TokenBucketRateLimiter;
import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.QuotaExceededException;
import dev.brainlift.research.TransientServiceException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class ChatModelGenerationClientTest {

  @Mock private ChatModel chatModel;

  @Mock private ObjectProvider<ChatModel> chatModelProvider;

  private ChatModelGenerationClient client;

  @BeforeEach
  void setUp() {
    client =
        new ChatModelGenerationClient(
            chatModelProvider,
            new TokenBucketRateLimiter("generation", 10, 1.0, 0, Clock.systemUTC()));
  }

  private static ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  void completeReturnsModelTextAndPassesOptions() {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("## Experts"));
    ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);

    String text = client.complete("Create an Experts section", GenerationOptions.text(0.3, 1500));

    assertThat(text).isEqualTo("## Experts");
    verify(chatModel).chat(request.capture());
    assertThat(request.getValue().temperature()).isEqualTo(0.3);
    assertThat(request.getValue().maxOutputTokens()).isEqualTo(1500);
    assertThat(request.getValue().responseFormat()).isNull();
  }

  @Test
  void structuredOutputRequestsJson() {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("{\"experts\": []}"));
    ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);

    client.complete("prompt", new GenerationOptions(0.2, 500, true));

    verify(chatModel).chat(request.capture());
    assertThat(request.getValue().responseFormat()).isEqualTo(ResponseFormat.JSON);
  }

  @Test
  void missingModelFailsPermanently() {
    when(chatModelProvider.getIfAvailable()).thenReturn(null);

    assertThatThrownBy(() -> client.complete("prompt", GenerationOptions.text(0.3, 100)))
        .isInstanceOf(PermanentJobException.class)
        .hasMessageContaining("No chat model configured");
  }

  @Test
  void blankReplyFailsPermanently() {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("   "));

    assertThatThrownBy(() -> client.complete("prompt", GenerationOptions.text(0.3, 100)))
        .isInstanceOf(PermanentJobException.class);
  }

  @Test
  void connectionProblemsAreTransient() {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new RuntimeException("Connection reset by peer"));

    assertThatThrownBy(() -> client.complete("prompt", GenerationOptions.text(0.3, 100)))
        .isInstanceOf(TransientServiceException.class);
  }

  @Test
  void exhaustedQuotaIsReportedAsQuota() {
    when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new RuntimeException("You exceeded your current quota (insufficient_quota)"));

    assertThatThrownBy(() -> client.complete("prompt", GenerationOptions.text(0.3, 100)))
        .isInstanceOf(QuotaExceededException.class);
  }

  @Test
  void invalidOptionsAreRejected() {
    assertThatThrownBy(() -> GenerationOptions.text(2.5, 100))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> GenerationOptions.text(0.5, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

package dev.brainlift.generation;

import dev.brainlift.ratelimit.TokenBucketRateLimiter;
import dev.brainlift.research.PermanentJobException;
import dev.brainlift.research.TransientServiceException;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * {@link GenerationClient} over a LangChain4j {@link ChatModel}.
 *
 * <p>Each attempt takes a token from the generation rate limiter. Transient failures (rate limits,
 * server errors, timeouts) are retried with exponential backoff; other failures propagate at once so
 * the pipeline can fall back to templated content.
 */
@Service
public class ChatModelGenerationClient implements GenerationClient {

  private static final Logger log = LoggerFactory.getLogger(ChatModelGenerationClient.class);

  private final ObjectProvider<ChatModel> chatModel;
  private final TokenBucketRateLimiter rateLimiter;

  public ChatModelGenerationClient(
      ObjectProvider<ChatModel> chatModel,
      @Qualifier("generationRateLimiter") TokenBucketRateLimiter rateLimiter) {
    this.chatModel = chatModel;
    this.rateLimiter = rateLimiter;
  }

  @Override
  @Retryable(
      retryFor = TransientServiceException.class,
      maxAttemptsExpression = "${brainlift.generation.retry.max-attempts:3}",
      backoff =
          @Backoff(
              delayExpression = "${brainlift.generation.retry.delay-ms:1000}",
              multiplierExpression = "${brainlift.generation.retry.multiplier:2.0}"))
  public String complete(String prompt, GenerationOptions options) {
    ChatModel model = chatModel.getIfAvailable();
    if (model == null) {
      throw new PermanentJobException("No chat model configured (brainlift.generation.api-key)");
    }
    acquireToken();

    ChatRequest.Builder request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .temperature(options.temperature())
            .maxOutputTokens(options.maxTokens());
    if (options.structuredOutput()) {
      request.responseFormat(ResponseFormat.JSON);
    }

    ChatResponse response;
    try {
      response = model.chat(request.build());
    } catch (RuntimeException e) {
      throw GenerationErrors.classify(e);
    }

    String text = response.aiMessage() == null ? null : response.aiMessage().text();
    if (text == null || text.isBlank()) {
      throw new PermanentJobException("Chat model returned no content");
    }
    log.debug("Generated {} characters (temperature={}, maxTokens={})",
        text.length(), options.temperature(), options.maxTokens());
    return text;
  }

  private void acquireToken() {
    try {
      rateLimiter.waitForToken();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PermanentJobException("Interrupted while waiting for a generation token", e);
    }
  }
}

package dev.brainlift.generation;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the OpenAI {@link ChatModel} when an API key is configured. */
@Configuration
public class GenerationConfig {

  /**
   * Provider-level retries are disabled; {@link ChatModelGenerationClient} retries rate limits
   * with its own backoff after taking a fresh rate limiter token.
   */
  @Bean
  @ConditionalOnExpression("'${brainlift.generation.api-key:}' != ''")
  public ChatModel chatModel(GenerationProperties properties) {
    return OpenAiChatModel.builder()
        .apiKey(properties.apiKey())
        .modelName(properties.modelName())
        .timeout(properties.timeout())
        .maxRetries(0)
        .build();
  }
}

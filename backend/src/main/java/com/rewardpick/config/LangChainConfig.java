package com.rewardpick.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LangChainConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChainConfig.class);

    /**
     * Registered only when an API key is present. Retries stay off here; a failed call is
     * answered with a templated summary instead.
     */
    @Bean
    @ConditionalOnExpression("!'${llm.api-key:}'.isBlank()")
    public ChatModel chatModel(LlmProperties properties) {
        log.info("Gemini chat model configured (model={}, timeoutSeconds={})", properties.getChatModel(), properties.getTimeoutSeconds());
        return GoogleAiGeminiChatModel.builder()
            .apiKey(properties.getApiKey())
            .modelName(properties.getChatModel())
            .temperature(properties.getTemperature())
            .timeout(Duration.ofSeconds(Math.max(properties.getTimeoutSeconds(), 1)))
            .maxRetries(0)
            .build();
    }

    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    public EmbeddingModel embeddingModel(LlmProperties properties) {
        String provider = properties.getEmbeddingProvider() == null
            ? "local"
            : properties.getEmbeddingProvider().trim().toLowerCase(Locale.ROOT);

        return switch (provider) {
            case "gemini" -> {
                if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
                    throw new IllegalStateException("llm.embedding-provider=gemini requires llm.api-key");
                }
                log.info("Using Gemini embeddings (model={})", properties.getEmbeddingModel());
                yield GoogleAiEmbeddingModel.builder()
                    .apiKey(properties.getApiKey())
                    .modelName(properties.getEmbeddingModel())
                    .timeout(Duration.ofSeconds(Math.max(properties.getTimeoutSeconds(), 1)))
                    .maxRetries(0)
                    .build();
            }
            case "local" -> {
                log.info("Using bundled all-MiniLM-L6-v2 embeddings");
                yield new AllMiniLmL6V2EmbeddingModel();
            }
            default -> throw new IllegalArgumentException("Unsupported embedding provider: " + provider);
        };
    }
}

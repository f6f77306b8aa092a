package com.rewardpick.recommendation.service;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class GeminiAnswerGenerator implements AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(GeminiAnswerGenerator.class);

    private static final String INSTRUCTIONS = String.join(
        "\n",
        "You are a credit card rewards assistant.",
        "Explain the ranking below to the user in at most four short sentences, in the language of the question.",
        "Use only the facts listed. Do not change the order, the rates or the card names.",
        "If a card requires switching its reward plan in the issuer's app, say so explicitly."
    );

    private final ObjectProvider<ChatModel> chatModelProvider;

    public GeminiAnswerGenerator(ObjectProvider<ChatModel> chatModelProvider) {
        this.chatModelProvider = chatModelProvider;
    }

    @Override
    public String generate(String prompt, List<String> groundingFacts) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new GenerationUnavailableException(GenerationUnavailableException.Reason.NOT_CONFIGURED, "llm.api-key is not set");
        }

        List<ChatMessage> messages = List.of(
            SystemMessage.from(INSTRUCTIONS + "\n\nFacts:\n" + String.join("\n\n", groundingFacts)),
            UserMessage.from(prompt)
        );

        ChatResponse response;
        try {
            response = chatModel.chat(messages);
        } catch (RuntimeException exception) {
            GenerationUnavailableException.Reason reason = classify(exception);
            throw new GenerationUnavailableException(reason, shortMessage(exception), exception);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new GenerationUnavailableException(GenerationUnavailableException.Reason.UNAVAILABLE, "model returned an empty answer");
        }
        log.debug("Answer generated (chars={})", text.length());
        return text.trim();
    }

    static GenerationUnavailableException.Reason classify(Throwable throwable) {
        Throwable cursor = throwable;
        int hops = 0;
        while (cursor != null && hops++ < 20) {
            if (cursor instanceof HttpException httpException && httpException.statusCode() == 429) {
                return GenerationUnavailableException.Reason.QUOTA_EXCEEDED;
            }
            if (cursor instanceof TimeoutException
                || cursor instanceof SocketTimeoutException
                || cursor instanceof HttpTimeoutException) {
                return GenerationUnavailableException.Reason.TIMEOUT;
            }

            String message = cursor.getMessage() == null ? "" : cursor.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("resource_exhausted") || message.contains("quota") || message.contains("429")) {
                return GenerationUnavailableException.Reason.QUOTA_EXCEEDED;
            }
            if (message.contains("timeout") || message.contains("timed out")) {
                return GenerationUnavailableException.Reason.TIMEOUT;
            }

            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        return GenerationUnavailableException.Reason.UNAVAILABLE;
    }

    private String shortMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        String singleLine = message.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= 200 ? singleLine : singleLine.substring(0, 200) + "...";
    }
}

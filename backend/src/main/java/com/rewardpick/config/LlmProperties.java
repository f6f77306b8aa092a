package com.rewardpick.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /**
     * Gemini API key; answer generation falls back to templates while it is blank
     */
    private String apiKey = "";

    private String chatModel = "gemini-2.5-flash";

    private double temperature = 0.3;

    private int timeoutSeconds = 20;

    /**
     * local (bundled all-MiniLM-L6-v2) or gemini
     */
    private String embeddingProvider = "local";

    private String embeddingModel = "text-embedding-004";
}

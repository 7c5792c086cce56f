package com.lumina.agent.llm;

import lombok.Data;

/**
 * Holds config for a single OpenAI-compatible provider.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 4096;
    private double temperature = 0.3;
}

package com.lumina.agent.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-task override of the configured provider settings. Null fields fall back
 * to the provider's configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmConfigOverride {

    private String provider;
    private String model;
    private Double temperature;
    private Integer maxTokens;
}

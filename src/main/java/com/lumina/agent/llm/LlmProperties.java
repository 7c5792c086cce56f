package com.lumina.agent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider table bound from application.yml under "llm". The agent core never
 * reads this; it only sees the ModelClient built from it.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    private String provider = "deepseek";
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Upper bound on one HTTP exchange, well above the agent's slow-request threshold */
    private Duration responseTimeout = Duration.ofMinutes(5);

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();
}

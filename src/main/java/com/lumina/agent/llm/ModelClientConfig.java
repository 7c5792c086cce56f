package com.lumina.agent.llm;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one OpenAI-compatible client per configured provider and routes
 * between them. Wrapped by ResilientModelClient with a circuit breaker.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class ModelClientConfig {

    private final LlmProperties llmProperties;

    @PostConstruct
    public void logActiveProvider() {
        LlmProviderProperties active = llmProperties.getProviders().get(llmProperties.getProvider());
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", llmProperties.getProvider().toUpperCase());
        log.info("  Model               : {}", active != null ? active.getModel() : "<not configured>");
        log.info("  Providers available : {}", llmProperties.getProviders().keySet());
        log.info("================================================================");
        if (active != null) {
            logKey(llmProperties.getProvider(), active.getApiKey());
        }
    }

    @Bean("providerModelClient")
    public ModelClient providerModelClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        Map<String, ModelClient> clients = new LinkedHashMap<>();
        llmProperties.getProviders().forEach((name, props) ->
                clients.put(name.toLowerCase(), new GenericModelClient(props, name, builder.clone())));
        return new ProviderRoutingModelClient(clients, llmProperties.getProvider().toLowerCase());
    }

    private void logKey(String name, String key) {
        if (key == null || key.isBlank()) {
            log.warn("  {} API key not set (fine for local providers such as ollama)", name);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}

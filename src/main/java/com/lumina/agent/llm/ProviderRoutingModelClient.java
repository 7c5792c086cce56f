package com.lumina.agent.llm;

import com.lumina.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Picks the provider client per call: the task's override provider when it names
 * a configured one, otherwise the default.
 */
@Slf4j
public class ProviderRoutingModelClient implements ModelClient {

    private final Map<String, ModelClient> clients;
    private final String defaultProvider;

    public ProviderRoutingModelClient(Map<String, ModelClient> clients, String defaultProvider) {
        if (!clients.containsKey(defaultProvider)) {
            throw new IllegalArgumentException("Default provider '" + defaultProvider
                    + "' is not configured. Configured: " + clients.keySet());
        }
        this.clients = Map.copyOf(clients);
        this.defaultProvider = defaultProvider;
    }

    @Override
    public ModelReply call(List<Message> messages, ModelCallOptions options) {
        return select(options).call(messages, options);
    }

    @Override
    public void stream(List<Message> messages, ModelCallOptions options, Consumer<StreamChunk> sink) {
        select(options).stream(messages, options, sink);
    }

    ModelClient select(ModelCallOptions options) {
        LlmConfigOverride override = options.getOverride();
        if (override != null && override.getProvider() != null) {
            ModelClient client = clients.get(override.getProvider().toLowerCase());
            if (client != null) return client;
            log.warn("Unknown provider override '{}', using {}", override.getProvider(), defaultProvider);
        }
        return clients.get(defaultProvider);
    }
}

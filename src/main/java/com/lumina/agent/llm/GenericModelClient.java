package com.lumina.agent.llm;

import com.lumina.agent.exception.ModelTransportException;
import com.lumina.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat client. Works with DeepSeek, OpenAI, Moonshot, Groq,
 * Gemini's OpenAI endpoint, OpenRouter and Ollama's /v1 endpoint.
 *
 * Tools are described in the system prompt and invoked through tags in the reply
 * text, so the request carries no "tools" array and the reply is returned raw.
 *
 * Error handling:
 *
 * | Error              | Action                                         |
 * |--------------------|------------------------------------------------|
 * | 401 / 403          | ModelTransportException with key guidance      |
 * | 429                | ModelTransportException (rate limited)         |
 * | other 4xx / 5xx    | ModelTransportException with provider body     |
 * | network error      | ModelTransportException wrapping the cause     |
 * | no choices         | ModelTransportException                        |
 *
 * The agent loop decides whether to retry; this client never does. When the
 * options carry a cancellation token, cancelling it aborts the HTTP exchange
 * (requires the {@link CancellableRequestFactory} configured in HttpClientConfig).
 */
@Slf4j
public class GenericModelClient implements ModelClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericModelClient(LlmProviderProperties props,
                              String providerName,
                              RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        RestClient.Builder builder = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    public String getProviderName() {
        return providerName;
    }

    @Override
    public ModelReply call(List<Message> messages, ModelCallOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, options);

        log.debug("Sending {} messages to {} [model={}]",
                messages.size(), providerName, requestBody.get("model"));

        try {
            Map<String, Object> response = CancellableRequestFactory.withCancellation(
                    options.getCancellationToken(), () -> restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} error [{}]: {}", providerName, res.getStatusCode(), body);
                        throw translateError(res.getStatusCode().value(), body);
                    })
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {}));

            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new ModelTransportException(providerName + " is unreachable: " + e.getMessage(), e);
        }
    }

    private ModelTransportException translateError(int statusCode, String body) {
        if (statusCode == 401 || statusCode == 403) {
            return new ModelTransportException(
                    providerName + " rejected the API key. Check llm.providers." + providerName + ".api-key.");
        }
        if (statusCode == 429) {
            return new ModelTransportException(providerName + " rate limit exceeded");
        }
        return new ModelTransportException(providerName + " error [" + statusCode + "]: " + body);
    }

    Map<String, Object> buildRequestBody(List<Message> messages, ModelCallOptions options) {
        LlmConfigOverride override = options.getOverride();

        String model = override != null && override.getModel() != null
                ? override.getModel() : props.getModel();
        double temperature = options.getTemperature() != null ? options.getTemperature()
                : override != null && override.getTemperature() != null ? override.getTemperature()
                : props.getTemperature();
        int maxTokens = options.getMaxTokens() != null ? options.getMaxTokens()
                : override != null && override.getMaxTokens() != null ? override.getMaxTokens()
                : props.getMaxTokens();

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", messages.stream()
                .map(m -> Map.of(
                        "role", m.getRole().name(),
                        "content", m.getContent() != null ? m.getContent() : ""))
                .toList());
        return body;
    }

    @SuppressWarnings("unchecked")
    ModelReply parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new ModelTransportException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new ModelTransportException(providerName + " returned no choices in response");
        }

        TokenUsage usage = null;
        Map<String, Object> usageMap = (Map<String, Object>) response.get("usage");
        if (usageMap != null) {
            int prompt     = ((Number) usageMap.getOrDefault("prompt_tokens", 0)).intValue();
            int completion = ((Number) usageMap.getOrDefault("completion_tokens", 0)).intValue();
            usage = TokenUsage.of(prompt, completion);
            log.debug("Token usage — prompt={} completion={}", prompt, completion);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;

        return ModelReply.builder()
                .content(content != null ? content : "")
                .usage(usage)
                .build();
    }
}

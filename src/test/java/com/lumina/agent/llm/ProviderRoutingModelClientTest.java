package com.lumina.agent.llm;

import com.lumina.agent.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRoutingModelClientTest {

    private final ModelClient deepseek = (messages, options) -> ModelReply.of("from deepseek");
    private final ModelClient ollama = (messages, options) -> ModelReply.of("from ollama");
    private final ProviderRoutingModelClient router =
            new ProviderRoutingModelClient(Map.of("deepseek", deepseek, "ollama", ollama), "deepseek");

    private static ModelCallOptions withProvider(String provider) {
        return ModelCallOptions.builder()
                .override(LlmConfigOverride.builder().provider(provider).build())
                .build();
    }

    @Test
    void call_withoutOverride_usesDefault() {
        assertThat(router.call(List.of(Message.user("hi")), ModelCallOptions.defaults()).getContent())
                .isEqualTo("from deepseek");
    }

    @Test
    void call_withOverride_routesCaseInsensitively() {
        assertThat(router.call(List.of(), withProvider("Ollama")).getContent()).isEqualTo("from ollama");
    }

    @Test
    void call_withUnknownOverride_fallsBackToDefault() {
        assertThat(router.call(List.of(), withProvider("mistral")).getContent()).isEqualTo("from deepseek");
    }

    @Test
    void stream_defaultFallsBackToSingleTextChunk() {
        List<StreamChunk> chunks = new ArrayList<>();

        router.stream(List.of(), withProvider("ollama"), chunks::add);

        assertThat(chunks).containsExactly(StreamChunk.text("from ollama"));
    }

    @Test
    void unknownDefaultProvider_isRejected() {
        assertThatThrownBy(() -> new ProviderRoutingModelClient(Map.of("ollama", ollama), "deepseek"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.lumina.agent.llm;

import com.lumina.agent.core.CancellationToken;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelCallOptions {

    CancellationToken cancellationToken;
    Double temperature;
    Integer maxTokens;
    LlmConfigOverride override;

    public static ModelCallOptions defaults() {
        return ModelCallOptions.builder().build();
    }
}

package com.lumina.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation extracted from one assistant reply.
 * Lives only for the turn that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String name;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();
}

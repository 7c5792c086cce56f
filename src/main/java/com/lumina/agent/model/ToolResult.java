package com.lumina.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    private boolean success;
    private String content;

    /** Present only when success = false */
    private String error;

    public static ToolResult ok(String content) {
        return new ToolResult(true, content, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, "", error);
    }
}

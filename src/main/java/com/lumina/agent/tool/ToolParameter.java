package com.lumina.agent.tool;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ToolParameter {

    String name;
    String description;
    boolean required;

    public static ToolParameter required(String name, String description) {
        return new ToolParameter(name, description, true);
    }

    public static ToolParameter optional(String name, String description) {
        return new ToolParameter(name, description, false);
    }
}

package com.lumina.agent.tool;

import lombok.Builder;
import lombok.Value;

/**
 * What a tool knows about the task that invoked it.
 */
@Value
@Builder
public class ToolContext {

    String workspacePath;
    String activeNotePath;
}

package com.lumina.agent.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class AgentCoreConfig {

    /** The parser only recognizes tags of registered tools. */
    @Bean
    public MessageParser messageParser(ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        log.info("Message parser recognizes {} tool tags", toolRegistry.toolCount());
        return new MessageParser(toolRegistry.getToolNames(), objectMapper);
    }
}

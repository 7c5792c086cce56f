package com.lumina.agent;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.config.ToolProperties;
import com.lumina.agent.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, LlmProperties.class})
public class LuminaAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(LuminaAgentApplication.class, args);
    }
}

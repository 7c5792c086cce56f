package com.lumina.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Loop policy knobs, bound from application.yml under "agent".
 * The defaults reproduce the behaviour users already know from the desktop app.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Back-to-back recoverable failures tolerated before a task ends in error */
    private int maxConsecutiveErrors = 3;

    /** Free-text replies shorter than this count as a terminal acknowledgement in action modes */
    private int shortReplyThreshold = 50;

    /** Use ModelClient.stream instead of ModelClient.call */
    private boolean streaming = false;

    /** Sampling temperature when the task carries no override */
    private Double temperature;

    private Timeout timeout = new Timeout();
    private Rag rag = new Rag();

    @Data
    public static class Timeout {
        /** A model call older than this is reported as slow. It is never cancelled automatically. */
        private Duration threshold = Duration.ofMinutes(2);
        private Duration checkInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Rag {
        private boolean enabled = true;
        private int limit = 10;
        /** Messages shorter than this skip the search */
        private int minQueryLength = 5;
        /** How many hits are inlined into the task message */
        private int topResults = 3;
        private int previewChars = 600;
        /** Root the keyword search indexes; usually the user's vault */
        private String indexRoot = "./workspace";
    }
}

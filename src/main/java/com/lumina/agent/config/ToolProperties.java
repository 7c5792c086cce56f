package com.lumina.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the workspace tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Workspace workspace = new Workspace();

    /**
     * Per-tool approval overrides, e.g. {@code create_note: false} to let the
     * agent create notes without asking. Tools not listed keep their own default.
     */
    private Map<String, Boolean> approval = new HashMap<>();

    @Data
    public static class Workspace {
        private int maxFileSizeKb = 512;
        private String allowedExtensions = "md,txt,json,csv,yaml,yml";
        private int listDepth = 3;
        private int searchLimit = 5;

        public List<String> getAllowedExtensionList() {
            if (allowedExtensions == null || allowedExtensions.isBlank()) return List.of();
            return Arrays.stream(allowedExtensions.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .map(String::toLowerCase)
                    .toList();
        }
    }
}

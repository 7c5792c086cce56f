package com.lumina.agent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Persona the agent runs under. The role definition opens the system prompt.
 */
public enum AgentMode {
    EDITOR("editor", "Editor",
            "You are a meticulous note editor. You improve, restructure and correct notes "
                    + "in the user's workspace, always through the available tools.",
            true),
    ORGANIZER("organizer", "Organizer",
            "You are a workspace organizer. You create folders, move and tidy notes so the "
                    + "workspace stays easy to navigate, always through the available tools.",
            true),
    WRITER("writer", "Writer",
            "You are a writing partner. You draft, expand and polish text with the user and "
                    + "save results into notes when asked.",
            false),
    RESEARCHER("researcher", "Researcher",
            "You are a research assistant. You search the user's notes, connect ideas across "
                    + "them and answer with references to the notes you used.",
            false);

    private final String slug;
    private final String displayName;
    private final String roleDefinition;
    private final boolean actionOriented;

    AgentMode(String slug, String displayName, String roleDefinition, boolean actionOriented) {
        this.slug = slug;
        this.displayName = displayName;
        this.roleDefinition = roleDefinition;
        this.actionOriented = actionOriented;
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getRoleDefinition() {
        return roleDefinition;
    }

    public boolean isActionOriented() {
        return actionOriented;
    }

    @JsonCreator
    public static AgentMode fromSlug(String slug) {
        if (slug == null || slug.isBlank()) return EDITOR;
        return Arrays.stream(values())
                .filter(m -> m.slug.equalsIgnoreCase(slug.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown mode: " + slug));
    }
}

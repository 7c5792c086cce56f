package com.lumina.agent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * What the user is trying to do, as classified upstream of the loop.
 * create, edit and organize oblige the model to act through tools.
 */
public enum TaskIntent {
    CHAT("chat"),
    SEARCH("search"),
    EDIT("edit"),
    CREATE("create"),
    ORGANIZE("organize");

    private final String slug;

    TaskIntent(String slug) {
        this.slug = slug;
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    public boolean isExplicitAction() {
        return this == EDIT || this == CREATE || this == ORGANIZE;
    }

    @JsonCreator
    public static TaskIntent fromSlug(String slug) {
        if (slug == null || slug.isBlank()) return null;
        return Arrays.stream(values())
                .filter(i -> i.slug.equalsIgnoreCase(slug.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown intent: " + slug));
    }
}

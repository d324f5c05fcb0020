package com.ragmodule.chunking;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChunkingStrategy {
    FIXED("fixed"),
    LINES("lines");

    private final String wireName;

    ChunkingStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ChunkingStrategy fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ChunkingStrategy strategy : values()) {
            if (strategy.wireName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown chunking strategy: " + value);
    }
}

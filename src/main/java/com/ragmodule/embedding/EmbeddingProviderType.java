package com.ragmodule.embedding;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EmbeddingProviderType {
    HTTP("http"),
    HASHING("hashing");

    private final String wireName;

    EmbeddingProviderType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EmbeddingProviderType fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EmbeddingProviderType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported embeddings provider: " + value);
    }
}

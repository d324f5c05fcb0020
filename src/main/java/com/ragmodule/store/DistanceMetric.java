package com.ragmodule.store;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DistanceMetric {
    COSINE("Cosine"),
    EUCLID("Euclid"),
    DOT("Dot");

    private final String wireName;

    DistanceMetric(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DistanceMetric fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DistanceMetric metric : values()) {
            if (metric.wireName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown distance metric: " + value + " (expected Cosine, Euclid or Dot)");
    }
}

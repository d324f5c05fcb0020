package com.ragmodule.store;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record PointFilter(List<FieldCondition> must) {
    public PointFilter {
        must = must == null ? List.of() : List.copyOf(must);
    }

    public static PointFilter matchAll() {
        return new PointFilter(List.of());
    }

    public static PointFilter allOf(Map<String, ?> equalities) {
        if (equalities == null || equalities.isEmpty()) {
            return matchAll();
        }
        List<FieldCondition> conditions = new ArrayList<>(equalities.size());
        for (Map.Entry<String, ?> entry : equalities.entrySet()) {
            conditions.add(new FieldCondition(entry.getKey(), entry.getValue()));
        }
        return new PointFilter(conditions);
    }

    public boolean isEmpty() {
        return must.isEmpty();
    }

    public boolean matches(Map<String, Object> payload) {
        return must.stream().allMatch(condition -> condition.matches(payload));
    }

    public record FieldCondition(String key, Object value) {
        public FieldCondition {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Filter key must not be blank");
            }
            if (!(value instanceof String || isIntegral(value) || value instanceof Boolean)) {
                throw new IllegalArgumentException("Filter value for '" + key + "' must be a string, integer or boolean, got "
                        + (value == null ? "null" : value.getClass().getSimpleName() + " " + value));
            }
        }

        // Qdrant matches keywords, integers and booleans only.
        private static boolean isIntegral(Object value) {
            return value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte
                    || value instanceof BigInteger;
        }

        boolean matches(Map<String, Object> payload) {
            Object actual = payload.get(key);
            if (actual instanceof Number a && value instanceof Number b) {
                return a.doubleValue() == b.doubleValue();
            }
            return value.equals(actual);
        }
    }
}

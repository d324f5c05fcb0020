package com.ragmodule.store;

import java.util.Map;

public record ScoredPoint(String id, double score, Map<String, Object> payload) {
    public ScoredPoint {
        payload = payload == null ? Map.of() : payload;
    }
}

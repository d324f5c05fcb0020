package com.ragmodule.store;

import java.util.Map;

public record Point(String id, float[] vector, Map<String, Object> payload) {
    public Point {
        payload = payload == null ? Map.of() : payload;
    }
}

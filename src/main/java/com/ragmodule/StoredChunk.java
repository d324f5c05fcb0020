package com.ragmodule;

import java.util.Map;

public record StoredChunk(String id, String content, Map<String, Object> payload, float[] vector) {
}

package com.ragmodule;

import java.util.Map;

public record RetrievedChunk(String content, double score, Map<String, Object> metadata) {
}

package com.ragmodule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RetrievalOptions(Integer limit, Double scoreThreshold, Map<String, Object> filter) {
    private static final RetrievalOptions NONE = new RetrievalOptions(null, null, null);

    public RetrievalOptions {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        filter = filter == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
    }

    public static RetrievalOptions defaults() {
        return NONE;
    }

    public static RetrievalOptions limit(int limit) {
        return new RetrievalOptions(limit, null, null);
    }

    public RetrievalOptions withLimit(Integer limit) {
        return new RetrievalOptions(limit, scoreThreshold, filter);
    }

    public RetrievalOptions withScoreThreshold(Double scoreThreshold) {
        return new RetrievalOptions(limit, scoreThreshold, filter);
    }

    public RetrievalOptions withFilter(Map<String, Object> filter) {
        return new RetrievalOptions(limit, scoreThreshold, filter);
    }
}

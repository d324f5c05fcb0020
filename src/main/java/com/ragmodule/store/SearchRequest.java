package com.ragmodule.store;

public record SearchRequest(
        float[] vector,
        int limit,
        Double scoreThreshold,
        PointFilter filter,
        boolean withPayload,
        boolean withVector) {
}

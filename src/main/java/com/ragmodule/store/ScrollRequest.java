package com.ragmodule.store;

public record ScrollRequest(
        PointFilter filter,
        int limit,
        String offset,
        boolean withPayload,
        boolean withVector) {
}

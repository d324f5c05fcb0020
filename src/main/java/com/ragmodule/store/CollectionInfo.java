package com.ragmodule.store;

public record CollectionInfo(String name, int vectorSize, DistanceMetric distance) {
}

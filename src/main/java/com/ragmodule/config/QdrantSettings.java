package com.ragmodule.config;

import com.ragmodule.store.DistanceMetric;

public record QdrantSettings(
        String url,
        String apiKey,
        String collectionName,
        int vectorSize,
        DistanceMetric distanceMetric,
        int timeoutMs,
        boolean verifyCollectionSchema) {

    @Override
    public String toString() {
        return "QdrantSettings{" +
                "url=" + url +
                ", apiKey=" + (apiKey == null ? "none" : "***") +
                ", collectionName=" + collectionName +
                ", vectorSize=" + vectorSize +
                ", distanceMetric=" + distanceMetric +
                ", timeoutMs=" + timeoutMs +
                ", verifyCollectionSchema=" + verifyCollectionSchema +
                '}';
    }
}

package com.ragmodule.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ragmodule.store.DistanceMetric;

@JsonIgnoreProperties(ignoreUnknown = true)
public class QdrantConfig {
    private String url;
    private String apiKey;
    private String collectionName;
    private Integer vectorSize;
    private DistanceMetric distanceMetric;
    private int timeoutMs = 30000;
    private boolean verifyCollectionSchema = true;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public void setCollectionName(String collectionName) {
        this.collectionName = collectionName;
    }

    public Integer getVectorSize() {
        return vectorSize;
    }

    public void setVectorSize(Integer vectorSize) {
        this.vectorSize = vectorSize;
    }

    public DistanceMetric getDistanceMetric() {
        return distanceMetric;
    }

    public void setDistanceMetric(DistanceMetric distanceMetric) {
        this.distanceMetric = distanceMetric;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public boolean isVerifyCollectionSchema() {
        return verifyCollectionSchema;
    }

    public void setVerifyCollectionSchema(boolean verifyCollectionSchema) {
        this.verifyCollectionSchema = verifyCollectionSchema;
    }
}

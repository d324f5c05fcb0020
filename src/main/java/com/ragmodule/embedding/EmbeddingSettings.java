package com.ragmodule.embedding;

public record EmbeddingSettings(
        EmbeddingProviderType providerType,
        String endpoint,
        String apiKey,
        String model,
        int dimension,
        int batchSize,
        int timeoutMs) {

    @Override
    public String toString() {
        return "EmbeddingSettings{" +
                "providerType=" + providerType +
                ", endpoint=" + endpoint +
                ", apiKey=" + (apiKey == null ? "none" : "***") +
                ", model=" + model +
                ", dimension=" + dimension +
                ", batchSize=" + batchSize +
                ", timeoutMs=" + timeoutMs +
                '}';
    }
}

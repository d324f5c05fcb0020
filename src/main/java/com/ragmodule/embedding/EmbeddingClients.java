package com.ragmodule.embedding;

import java.time.Duration;

import okhttp3.OkHttpClient;

public final class EmbeddingClients {
    private EmbeddingClients() {
    }

    public static EmbeddingClient create(EmbeddingSettings settings) {
        if (settings.providerType() == EmbeddingProviderType.HASHING) {
            return new HashingEmbeddingClient(settings.dimension());
        }
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(settings.timeoutMs()))
                .build();
        return new HttpEmbeddingClient(
                httpClient,
                settings.endpoint(),
                settings.apiKey(),
                settings.model(),
                settings.dimension(),
                settings.batchSize());
    }
}

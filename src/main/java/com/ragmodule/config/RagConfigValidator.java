package com.ragmodule.config;

import com.ragmodule.ConfigurationException;
import com.ragmodule.chunking.Chunker;
import com.ragmodule.chunking.Chunkers;
import com.ragmodule.embedding.EmbeddingProviderType;
import com.ragmodule.embedding.EmbeddingSettings;
import com.ragmodule.embedding.EmbeddingsConfig;

public final class RagConfigValidator {
    private RagConfigValidator() {
    }

    public static RagSettings validate(RagConfig config) {
        if (config == null) {
            throw new ConfigurationException("RAG configuration must not be null.");
        }
        if (config.getProvider() == null) {
            throw new ConfigurationException("RAG provider type must be specified in config.");
        }

        QdrantSettings qdrant = switch (config.getProvider()) {
            case QDRANT -> validateQdrant(config.getQdrant());
        };

        if (config.getEmbeddings() == null) {
            throw new ConfigurationException("embeddings config must be provided to handle internal embedding generation.");
        }
        EmbeddingSettings embeddings = validateEmbeddings(config.getEmbeddings(), qdrant.vectorSize());

        if (config.getDefaultRetrievalLimit() <= 0) {
            throw new ConfigurationException("defaultRetrievalLimit must be positive, got " + config.getDefaultRetrievalLimit());
        }

        return new RagSettings(
                config.getProvider(),
                qdrant,
                embeddings,
                chunker(config),
                config.getDefaultRetrievalLimit(),
                config.getDefaultScoreThreshold(),
                config.isDebug());
    }

    private static QdrantSettings validateQdrant(QdrantConfig qdrant) {
        if (qdrant == null) {
            throw new ConfigurationException("qdrant config must be provided when provider is qdrant.");
        }
        if (isBlank(qdrant.getUrl())) {
            throw new ConfigurationException("qdrant.url must be specified.");
        }
        if (isBlank(qdrant.getCollectionName())) {
            throw new ConfigurationException("qdrant.collectionName must be specified.");
        }
        if (qdrant.getVectorSize() == null) {
            throw new ConfigurationException("qdrant.vectorSize must be specified.");
        }
        if (qdrant.getVectorSize() <= 0) {
            throw new ConfigurationException("qdrant.vectorSize must be positive, got " + qdrant.getVectorSize());
        }
        if (qdrant.getDistanceMetric() == null) {
            throw new ConfigurationException("qdrant.distanceMetric must be specified.");
        }
        if (qdrant.getTimeoutMs() <= 0) {
            throw new ConfigurationException("qdrant.timeoutMs must be positive.");
        }
        return new QdrantSettings(
                qdrant.getUrl().trim(),
                isBlank(qdrant.getApiKey()) ? null : qdrant.getApiKey(),
                qdrant.getCollectionName().trim(),
                qdrant.getVectorSize(),
                qdrant.getDistanceMetric(),
                qdrant.getTimeoutMs(),
                qdrant.isVerifyCollectionSchema());
    }

    private static EmbeddingSettings validateEmbeddings(EmbeddingsConfig embeddings, int vectorSize) {
        if (embeddings.getProviderType() == null) {
            throw new ConfigurationException("embeddings.providerType must be specified.");
        }
        if (embeddings.getProviderType() == EmbeddingProviderType.HTTP && isBlank(embeddings.getEndpoint())) {
            throw new ConfigurationException("embeddings.endpoint must be specified for the http embeddings provider.");
        }
        if (embeddings.getDimension() < 0) {
            throw new ConfigurationException("embeddings.dimension must not be negative.");
        }
        if (embeddings.getBatchSize() <= 0) {
            throw new ConfigurationException("embeddings.batchSize must be positive.");
        }
        if (embeddings.getTimeoutMs() <= 0) {
            throw new ConfigurationException("embeddings.timeoutMs must be positive.");
        }
        return new EmbeddingSettings(
                embeddings.getProviderType(),
                isBlank(embeddings.getEndpoint()) ? null : embeddings.getEndpoint().trim(),
                isBlank(embeddings.getApiKey()) ? null : embeddings.getApiKey(),
                embeddings.getModel(),
                embeddings.getDimension() > 0 ? embeddings.getDimension() : vectorSize,
                embeddings.getBatchSize(),
                embeddings.getTimeoutMs());
    }

    private static Chunker chunker(RagConfig config) {
        if (config.getCustomChunker() != null) {
            return config.getCustomChunker();
        }
        try {
            return Chunkers.fromConfig(config.getChunking());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid chunking config: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

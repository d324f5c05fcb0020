package com.ragmodule.config;

import com.ragmodule.chunking.Chunker;
import com.ragmodule.embedding.EmbeddingSettings;

public record RagSettings(
        ProviderType provider,
        QdrantSettings qdrant,
        EmbeddingSettings embeddings,
        Chunker chunker,
        int defaultRetrievalLimit,
        Double defaultScoreThreshold,
        boolean debug) {
}

package com.ragmodule;

import com.ragmodule.config.ProviderType;
import com.ragmodule.config.QdrantConfig;
import com.ragmodule.config.RagConfig;
import com.ragmodule.embedding.EmbeddingProviderType;
import com.ragmodule.embedding.EmbeddingsConfig;
import com.ragmodule.store.DistanceMetric;

public final class TestConfigs {
    public static final String COLLECTION = "test-docs";
    public static final int VECTOR_SIZE = 64;

    private TestConfigs() {
    }

    /**
     * A complete config using the local hashing embedder, so no embedding server is needed.
     */
    public static RagConfig valid() {
        QdrantConfig qdrant = new QdrantConfig();
        qdrant.setUrl("http://localhost:6333");
        qdrant.setCollectionName(COLLECTION);
        qdrant.setVectorSize(VECTOR_SIZE);
        qdrant.setDistanceMetric(DistanceMetric.COSINE);

        EmbeddingsConfig embeddings = new EmbeddingsConfig();
        embeddings.setProviderType(EmbeddingProviderType.HASHING);

        RagConfig config = new RagConfig();
        config.setProvider(ProviderType.QDRANT);
        config.setQdrant(qdrant);
        config.setEmbeddings(embeddings);
        return config;
    }
}

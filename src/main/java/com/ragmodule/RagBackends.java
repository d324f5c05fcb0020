package com.ragmodule;

import java.time.Duration;

import com.ragmodule.config.QdrantSettings;
import com.ragmodule.config.RagSettings;
import com.ragmodule.embedding.EmbeddingClient;
import com.ragmodule.embedding.EmbeddingClients;
import com.ragmodule.store.QdrantRestClient;
import com.ragmodule.store.VectorStoreClient;

/**
 * Builds the clients a {@link RagModule} talks to. Called on the initialization executor.
 */
public interface RagBackends {

    EmbeddingClient embeddingClient(RagSettings settings);

    VectorStoreClient vectorStoreClient(RagSettings settings);

    static RagBackends defaults() {
        return new RagBackends() {
            @Override
            public EmbeddingClient embeddingClient(RagSettings settings) {
                return EmbeddingClients.create(settings.embeddings());
            }

            @Override
            public VectorStoreClient vectorStoreClient(RagSettings settings) {
                QdrantSettings qdrant = settings.qdrant();
                return new QdrantRestClient(qdrant.url(), qdrant.apiKey(), Duration.ofMillis(qdrant.timeoutMs()));
            }
        };
    }
}

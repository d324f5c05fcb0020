package com.ragmodule.provider;

import java.util.List;
import java.util.Map;

import com.ragmodule.RetrievalOptions;
import com.ragmodule.RetrievedChunk;
import com.ragmodule.StoredChunk;

/**
 * Ingestion and retrieval against one vector store backend. Every operation except
 * {@link #initialize()} requires {@link ProviderState#READY}.
 */
public interface RagProvider {
    /**
     * Ensures the backing collection exists. Calling it again once ready is a no-op.
     */
    void initialize();

    ProviderState state();

    /**
     * Chunks, embeds and stores a document. Chunks whose embedding failed are skipped.
     *
     * @return ids of the stored chunks, in chunk order; empty when nothing was stored
     */
    List<String> addDocument(String content, Map<String, Object> metadata);

    /**
     * @return chunks in the order the backend ranked them, best first
     */
    List<RetrievedChunk> retrieveContext(String queryText, RetrievalOptions options);

    void deleteDocumentsByIds(List<String> ids);

    void deleteDocumentsByMetadata(Map<String, Object> filter);

    /**
     * Scans every page of points matching the filter.
     */
    List<StoredChunk> getDocumentsByMetadata(Map<String, Object> filter);

    /**
     * Drops the whole collection. A collection that does not exist counts as deleted.
     */
    void deleteStorage();
}

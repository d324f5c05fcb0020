package com.ragmodule.provider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragmodule.BackendOperationException;
import com.ragmodule.EmbeddingException;
import com.ragmodule.InitializationException;
import com.ragmodule.NotReadyException;
import com.ragmodule.RetrievalOptions;
import com.ragmodule.RetrievedChunk;
import com.ragmodule.StoredChunk;
import com.ragmodule.chunking.Chunker;
import com.ragmodule.config.QdrantSettings;
import com.ragmodule.embedding.EmbeddingClient;
import com.ragmodule.store.CollectionInfo;
import com.ragmodule.store.Point;
import com.ragmodule.store.PointFilter;
import com.ragmodule.store.QdrantException;
import com.ragmodule.store.ScoredPoint;
import com.ragmodule.store.ScrollPage;
import com.ragmodule.store.ScrollRequest;
import com.ragmodule.store.SearchRequest;
import com.ragmodule.store.VectorStoreClient;

public class QdrantProvider implements RagProvider {
    private static final Logger log = LoggerFactory.getLogger(QdrantProvider.class);

    public static final String CONTENT_FIELD = "content";
    public static final String CHUNK_INDEX_FIELD = "chunkIndex";
    static final int DEFAULT_RETRIEVAL_LIMIT = 5;
    static final int SCROLL_PAGE_SIZE = 250;

    private final QdrantSettings settings;
    private final VectorStoreClient client;
    private final EmbeddingClient embeddings;
    private final Chunker chunker;
    private final boolean debug;
    private final int scrollPageSize;
    private final AtomicReference<ProviderState> state = new AtomicReference<>(ProviderState.UNINITIALIZED);

    public QdrantProvider(QdrantSettings settings,
            VectorStoreClient client,
            EmbeddingClient embeddings,
            Chunker chunker,
            boolean debug) {
        this(settings, client, embeddings, chunker, debug, SCROLL_PAGE_SIZE);
    }

    QdrantProvider(QdrantSettings settings,
            VectorStoreClient client,
            EmbeddingClient embeddings,
            Chunker chunker,
            boolean debug,
            int scrollPageSize) {
        this.settings = settings;
        this.client = client;
        this.embeddings = embeddings;
        this.chunker = chunker;
        this.debug = debug;
        this.scrollPageSize = scrollPageSize;
        detail("QdrantProvider configured: {}", settings);
    }

    @Override
    public void initialize() {
        if (state.get() == ProviderState.READY) {
            log.info("QdrantProvider for collection '{}' is already initialized", collection());
            return;
        }
        if (!state.compareAndSet(ProviderState.UNINITIALIZED, ProviderState.INITIALIZING)) {
            throw new InitializationException("QdrantProvider initialization is already in progress");
        }
        try {
            ensureCollection();
            state.set(ProviderState.READY);
        } catch (IOException e) {
            state.set(ProviderState.UNINITIALIZED);
            log.error("Error during Qdrant initialization", e);
            throw new InitializationException("Qdrant initialization failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            state.set(ProviderState.UNINITIALIZED);
            throw e;
        }
    }

    @Override
    public ProviderState state() {
        return state.get();
    }

    private void ensureCollection() throws IOException {
        log.info("Checking for Qdrant collection '{}'...", collection());
        if (!client.listCollections().contains(collection())) {
            log.warn("Collection '{}' not found. Attempting to create...", collection());
            client.createCollection(collection(), settings.vectorSize(), settings.distanceMetric());
            log.info("Collection '{}' created (size={}, distance={})",
                    collection(), settings.vectorSize(), settings.distanceMetric().wireName());
            return;
        }
        log.info("Collection '{}' exists", collection());
        if (!settings.verifyCollectionSchema()) {
            return;
        }
        CollectionInfo info = client.getCollection(collection());
        if (info.vectorSize() != settings.vectorSize() || info.distance() != settings.distanceMetric()) {
            throw new InitializationException(String.format(
                    "Collection '%s' has size=%d distance=%s but the configuration expects size=%d distance=%s",
                    collection(),
                    info.vectorSize(),
                    info.distance() == null ? "unknown" : info.distance().wireName(),
                    settings.vectorSize(),
                    settings.distanceMetric().wireName()));
        }
    }

    @Override
    public List<String> addDocument(String content, Map<String, Object> metadata) {
        ensureReady();
        Map<String, Object> baseMetadata = metadata == null ? Map.of() : metadata;
        List<String> chunks = chunker.split(content);
        detail("Document split into {} chunks", chunks.size());
        if (chunks.isEmpty()) {
            log.warn("Document content resulted in zero chunks. Nothing to add.");
            return List.of();
        }

        List<Optional<float[]>> vectors;
        try {
            vectors = embeddings.embed(chunks);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding " + chunks.size() + " chunks failed: " + e.getMessage(), e);
        }
        if (vectors.size() != chunks.size()) {
            throw new EmbeddingException("Embedding client returned " + vectors.size() + " results for " + chunks.size() + " chunks");
        }

        List<Point> points = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            Optional<float[]> vector = vectors.get(i);
            if (vector.isEmpty()) {
                log.warn("Skipping chunk {} as it failed to produce an embedding.", i);
                continue;
            }
            Map<String, Object> payload = new LinkedHashMap<>(baseMetadata);
            payload.put(CONTENT_FIELD, chunks.get(i));
            payload.put(CHUNK_INDEX_FIELD, i);
            points.add(new Point(UUID.randomUUID().toString(), vector.get(), payload));
        }
        log.info("Generated embeddings for {}/{} chunks", points.size(), chunks.size());

        if (points.isEmpty()) {
            log.warn("All chunks failed to produce embeddings. Nothing to upsert.");
            return List.of();
        }

        try {
            client.upsert(collection(), points, true);
        } catch (IOException e) {
            log.error("Error upserting {} points to collection '{}'", points.size(), collection(), e);
            throw new BackendOperationException("upsert", "Qdrant upsert failed: " + e.getMessage(), e);
        }
        log.info("Upserted {} points to collection '{}'", points.size(), collection());
        return points.stream().map(Point::id).toList();
    }

    @Override
    public List<RetrievedChunk> retrieveContext(String queryText, RetrievalOptions options) {
        ensureReady();
        RetrievalOptions effective = options == null ? RetrievalOptions.defaults() : options;
        detail("Retrieving context for query \"{}\" with {}", preview(queryText), effective);

        float[] queryVector;
        try {
            queryVector = embeddings.embed(List.of(queryText)).stream()
                    .findFirst()
                    .flatMap(vector -> vector)
                    .orElseThrow(() -> new EmbeddingException("Failed to generate embedding for the query text."));
        } catch (IOException e) {
            throw new EmbeddingException("Failed to generate embedding for the query text: " + e.getMessage(), e);
        }

        SearchRequest request = new SearchRequest(
                queryVector,
                effective.limit() == null ? DEFAULT_RETRIEVAL_LIMIT : effective.limit(),
                effective.scoreThreshold(),
                PointFilter.allOf(effective.filter()),
                true,
                false);
        List<ScoredPoint> hits;
        try {
            hits = client.search(collection(), request);
        } catch (IOException e) {
            log.error("Error searching collection '{}'", collection(), e);
            throw new BackendOperationException("search", "Qdrant search failed: " + e.getMessage(), e);
        }
        detail("Qdrant search returned {} results", hits.size());
        return hits.stream().map(QdrantProvider::toRetrievedChunk).toList();
    }

    private static RetrievedChunk toRetrievedChunk(ScoredPoint hit) {
        Object content = hit.payload().get(CONTENT_FIELD);
        Map<String, Object> metadata = new LinkedHashMap<>(hit.payload());
        metadata.remove(CONTENT_FIELD);
        return new RetrievedChunk(
                content instanceof String text ? text : "",
                hit.score(),
                metadata.isEmpty() ? null : metadata);
    }

    @Override
    public List<StoredChunk> getDocumentsByMetadata(Map<String, Object> filter) {
        ensureReady();
        PointFilter pointFilter = PointFilter.allOf(filter);
        detail("Getting all documents by metadata filter {}", filter);

        List<Point> all = new ArrayList<>();
        String offset = null;
        try {
            do {
                ScrollPage page = client.scroll(collection(),
                        new ScrollRequest(pointFilter, scrollPageSize, offset, true, true));
                all.addAll(page.points());
                offset = page.nextPageOffset();
            } while (offset != null);
        } catch (IOException e) {
            log.error("Error scrolling through collection '{}'", collection(), e);
            throw new BackendOperationException("scroll", "Qdrant scroll failed: " + e.getMessage(), e);
        }
        detail("Retrieved a total of {} points for the filter", all.size());

        return all.stream()
                .map(point -> new StoredChunk(
                        point.id(),
                        point.payload().get(CONTENT_FIELD) instanceof String text ? text : null,
                        point.payload(),
                        point.vector()))
                .toList();
    }

    @Override
    public void deleteDocumentsByIds(List<String> ids) {
        ensureReady();
        if (ids == null || ids.isEmpty()) {
            log.warn("No IDs provided for deletion.");
            return;
        }
        log.info("Deleting {} documents by ID from collection '{}'", ids.size(), collection());
        try {
            client.deletePoints(collection(), ids, true);
        } catch (IOException e) {
            log.error("Error deleting documents by ID from collection '{}'", collection(), e);
            throw new BackendOperationException("delete", "Qdrant deletion by ID failed: " + e.getMessage(), e);
        }
        log.info("Deleted {} documents by ID", ids.size());
    }

    @Override
    public void deleteDocumentsByMetadata(Map<String, Object> filter) {
        ensureReady();
        if (filter == null || filter.isEmpty()) {
            log.warn("No filter provided for deletion by metadata.");
            return;
        }
        PointFilter pointFilter = PointFilter.allOf(filter);
        log.info("Deleting documents matching {} from collection '{}'", filter, collection());
        try {
            client.deleteByFilter(collection(), pointFilter, true);
        } catch (IOException e) {
            log.error("Error deleting documents by metadata from collection '{}'", collection(), e);
            throw new BackendOperationException("delete", "Qdrant deletion by filter failed: " + e.getMessage(), e);
        }
        // Qdrant reports no count for filter deletes; only acceptance is known here.
        log.info("Deletion request for documents matching {} accepted", filter);
    }

    @Override
    public void deleteStorage() {
        ensureReady();
        log.warn("Attempting to delete Qdrant collection '{}'...", collection());
        try {
            if (client.deleteCollection(collection())) {
                log.info("Deleted collection '{}'", collection());
            } else {
                log.warn("Deletion of collection '{}' returned false. It may not have existed.", collection());
            }
        } catch (QdrantException e) {
            if (!e.isNotFound()) {
                log.error("Error deleting collection '{}'", collection(), e);
                throw new BackendOperationException("deleteCollection", "Qdrant collection deletion failed: " + e.getMessage(), e);
            }
            log.warn("Collection '{}' was not found during deletion, which is acceptable.", collection());
        } catch (IOException e) {
            log.error("Error deleting collection '{}'", collection(), e);
            throw new BackendOperationException("deleteCollection", "Qdrant collection deletion failed: " + e.getMessage(), e);
        }
    }

    // INFO when the debug flag is set, DEBUG otherwise.
    private void detail(String format, Object... args) {
        if (debug) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private void ensureReady() {
        if (state.get() != ProviderState.READY) {
            throw new NotReadyException("QdrantProvider has not been initialized. Call initialize() first.");
        }
    }

    private String collection() {
        return settings.collectionName();
    }

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}

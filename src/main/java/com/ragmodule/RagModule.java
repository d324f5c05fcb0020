package com.ragmodule;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragmodule.config.RagConfig;
import com.ragmodule.config.RagConfigValidator;
import com.ragmodule.config.RagSettings;
import com.ragmodule.embedding.EmbeddingClient;
import com.ragmodule.provider.ProviderState;
import com.ragmodule.provider.QdrantProvider;
import com.ragmodule.provider.RagProvider;
import com.ragmodule.store.VectorStoreClient;

/**
 * Entry point for document ingestion and context retrieval.
 *
 * <p>Instances are obtained through {@link #create(RagConfig)}, which validates the configuration
 * synchronously and connects to the backends asynchronously. Every operation blocks on the
 * underlying HTTP calls and may be called from several threads.
 */
public final class RagModule implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RagModule.class);

    private final RagSettings settings;
    private RagProvider provider;
    private EmbeddingClient embeddingClient;
    private VectorStoreClient storeClient;
    private volatile boolean ready;

    private RagModule(RagConfig config) {
        this.settings = RagConfigValidator.validate(config);
        if (settings.debug()) {
            log.info("RagModule configured: provider={} qdrant={} embeddings={}",
                    settings.provider(), settings.qdrant(), settings.embeddings());
        }
    }

    public static CompletableFuture<RagModule> create(RagConfig config) {
        return create(config, RagBackends.defaults(), ForkJoinPool.commonPool());
    }

    /**
     * @throws ConfigurationException synchronously, before any future exists
     */
    public static CompletableFuture<RagModule> create(RagConfig config, RagBackends backends, Executor executor) {
        RagModule module = new RagModule(config);
        return CompletableFuture.supplyAsync(() -> {
            try {
                module.initialize(backends);
                return module;
            } catch (RuntimeException e) {
                module.close();
                throw new CompletionException(asInitializationFailure(e));
            }
        }, executor);
    }

    private void initialize(RagBackends backends) {
        log.info("Initializing RagModule with provider: {}", settings.provider());
        embeddingClient = backends.embeddingClient(settings);
        storeClient = backends.vectorStoreClient(settings);
        provider = switch (settings.provider()) {
            case QDRANT -> new QdrantProvider(
                    settings.qdrant(),
                    storeClient,
                    embeddingClient,
                    settings.chunker(),
                    settings.debug());
        };
        provider.initialize();
        ready = true;
        log.info("RagModule initialized successfully");
    }

    private static InitializationException asInitializationFailure(RuntimeException e) {
        if (e instanceof InitializationException initializationException) {
            return initializationException;
        }
        log.error("RagModule initialization failed", e);
        return new InitializationException("RagModule initialization failed: " + e.getMessage(), e);
    }

    public boolean isReady() {
        return ready && provider.state() == ProviderState.READY;
    }

    public List<String> addDocument(String content) {
        return addDocument(content, null);
    }

    public List<String> addDocument(String content, Map<String, Object> metadata) {
        ensureReady();
        return provider.addDocument(content, metadata);
    }

    public List<RetrievedChunk> retrieveContext(String queryText) {
        return retrieveContext(queryText, null);
    }

    /**
     * Per-call {@code limit} and {@code scoreThreshold} win over the configured defaults.
     */
    public List<RetrievedChunk> retrieveContext(String queryText, RetrievalOptions options) {
        ensureReady();
        RetrievalOptions given = options == null ? RetrievalOptions.defaults() : options;
        RetrievalOptions effective = new RetrievalOptions(
                given.limit() != null ? given.limit() : settings.defaultRetrievalLimit(),
                given.scoreThreshold() != null ? given.scoreThreshold() : settings.defaultScoreThreshold(),
                given.filter());
        return provider.retrieveContext(queryText, effective);
    }

    public void deleteDocumentsByIds(List<String> ids) {
        ensureReady();
        provider.deleteDocumentsByIds(ids);
    }

    public void deleteDocumentsByMetadata(Map<String, Object> filter) {
        ensureReady();
        provider.deleteDocumentsByMetadata(filter);
    }

    public List<StoredChunk> getDocumentsByMetadata(Map<String, Object> filter) {
        ensureReady();
        return provider.getDocumentsByMetadata(filter);
    }

    public void deleteStorage() {
        ensureReady();
        provider.deleteStorage();
    }

    public RagSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        ready = false;
        if (embeddingClient != null) {
            embeddingClient.close();
        }
        if (storeClient != null) {
            storeClient.close();
        }
    }

    private void ensureReady() {
        if (!ready) {
            throw new NotReadyException("RagModule is not ready. Wait for create() to complete.");
        }
    }
}

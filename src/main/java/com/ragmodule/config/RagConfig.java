package com.ragmodule.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ragmodule.chunking.Chunker;
import com.ragmodule.chunking.ChunkingConfig;
import com.ragmodule.embedding.EmbeddingsConfig;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RagConfig {
    private ProviderType provider;
    private QdrantConfig qdrant;
    private EmbeddingsConfig embeddings;
    private ChunkingConfig chunking;
    @JsonIgnore
    private Chunker customChunker;
    private int defaultRetrievalLimit = 5;
    private Double defaultScoreThreshold;
    private boolean debug;

    public ProviderType getProvider() {
        return provider;
    }

    public void setProvider(ProviderType provider) {
        this.provider = provider;
    }

    public QdrantConfig getQdrant() {
        return qdrant;
    }

    public void setQdrant(QdrantConfig qdrant) {
        this.qdrant = qdrant;
    }

    public EmbeddingsConfig getEmbeddings() {
        return embeddings;
    }

    public void setEmbeddings(EmbeddingsConfig embeddings) {
        this.embeddings = embeddings;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking;
    }

    public Chunker getCustomChunker() {
        return customChunker;
    }

    public void setCustomChunker(Chunker customChunker) {
        this.customChunker = customChunker;
    }

    public int getDefaultRetrievalLimit() {
        return defaultRetrievalLimit;
    }

    public void setDefaultRetrievalLimit(int defaultRetrievalLimit) {
        this.defaultRetrievalLimit = defaultRetrievalLimit;
    }

    public Double getDefaultScoreThreshold() {
        return defaultScoreThreshold;
    }

    public void setDefaultScoreThreshold(Double defaultScoreThreshold) {
        this.defaultScoreThreshold = defaultScoreThreshold;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}

package com.ragmodule.chunking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkingConfig {
    private ChunkingStrategy strategy = ChunkingStrategy.FIXED;
    private int chunkSize = FixedWindowChunker.DEFAULT_CHUNK_SIZE;
    private int chunkOverlap = FixedWindowChunker.DEFAULT_CHUNK_OVERLAP;

    public ChunkingStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(ChunkingStrategy strategy) {
        this.strategy = strategy == null ? ChunkingStrategy.FIXED : strategy;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }
}

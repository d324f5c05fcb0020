package com.ragmodule.chunking;

public final class Chunkers {
    private Chunkers() {
    }

    public static Chunker defaultChunker() {
        return new FixedWindowChunker();
    }

    public static Chunker fromConfig(ChunkingConfig config) {
        if (config == null) {
            return defaultChunker();
        }
        ChunkingStrategy strategy = config.getStrategy() == null ? ChunkingStrategy.FIXED : config.getStrategy();
        return switch (strategy) {
            case LINES -> new LineWindowChunker(config.getChunkSize(), config.getChunkOverlap());
            case FIXED -> new FixedWindowChunker(config.getChunkSize(), config.getChunkOverlap());
        };
    }
}

package com.ragmodule.chunking;

import java.util.ArrayList;
import java.util.List;

public class FixedWindowChunker implements Chunker {
    public static final int DEFAULT_CHUNK_SIZE = 300;
    public static final int DEFAULT_CHUNK_OVERLAP = 50;

    private final int chunkSize;
    private final int chunkOverlap;

    public FixedWindowChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP);
    }

    public FixedWindowChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, " + chunkSize + "), got " + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    @Override
    public List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= chunkSize) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int step = chunkSize - chunkOverlap;
        int start = 0;
        while (start < text.length()) {
            int endExclusive = Math.min(text.length(), start + chunkSize);
            chunks.add(text.substring(start, endExclusive));
            if (endExclusive == text.length()) {
                break;
            }
            start += step;
        }
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int chunkOverlap() {
        return chunkOverlap;
    }
}

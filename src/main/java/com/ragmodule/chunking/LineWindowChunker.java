package com.ragmodule.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class LineWindowChunker implements Chunker {
    private final int maxLines;
    private final int overlapLines;

    public LineWindowChunker(int maxLines, int overlapLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive, got " + maxLines);
        }
        if (overlapLines < 0 || overlapLines >= maxLines) {
            throw new IllegalArgumentException("overlapLines must be in [0, " + maxLines + "), got " + overlapLines);
        }
        this.maxLines = maxLines;
        this.overlapLines = overlapLines;
    }

    @Override
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] lines = text.split("\\R", -1);
        List<String> chunks = new ArrayList<>();

        int start = 0;
        while (start < lines.length) {
            int endExclusive = Math.min(lines.length, start + maxLines);
            String window = String.join("\n", Arrays.copyOfRange(lines, start, endExclusive));
            if (!window.isBlank()) {
                chunks.add(window);
            }
            if (endExclusive == lines.length) {
                break;
            }
            start = endExclusive - overlapLines;
        }
        return chunks;
    }
}

package com.ragmodule.chunking;

import java.util.List;

/**
 * Splits document text into the ordered chunks that get embedded and stored.
 * Any lambda of this shape can replace the built-in strategies.
 */
@FunctionalInterface
public interface Chunker {
    /**
     * @param text document content, may be empty
     * @return non-empty chunks in document order; empty when there is nothing to store
     */
    List<String> split(String text);
}

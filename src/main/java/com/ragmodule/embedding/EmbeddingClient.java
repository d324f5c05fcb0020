package com.ragmodule.embedding;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Turns text into fixed-length vectors.
 */
public interface EmbeddingClient extends Closeable {
    /**
     * Embeds a batch of texts.
     *
     * @return one slot per input, same order; an empty slot means that item could not be embedded
     * @throws IOException when the batch call as a whole fails
     */
    List<Optional<float[]>> embed(List<String> texts) throws IOException;

    /**
     * Expected vector length, or 0 when the client does not know it up front.
     */
    int dimension();

    @Override
    default void close() {
    }
}

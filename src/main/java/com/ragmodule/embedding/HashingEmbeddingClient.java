package com.ragmodule.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class HashingEmbeddingClient implements EmbeddingClient {
    private final int dimension;

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public List<Optional<float[]>> embed(List<String> texts) {
        List<Optional<float[]>> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(Optional.ofNullable(embedOne(text)));
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    // Blank text has no tokens to hash, so it yields no embedding.
    private float[] embedOne(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }
        return normalize(vector) ? vector : null;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static boolean normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return false;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return true;
    }
}

package com.ragmodule.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpEmbeddingClient implements EmbeddingClient {
    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final int batchSize;

    public HttpEmbeddingClient(OkHttpClient httpClient,
            String endpoint,
            String apiKey,
            String model,
            int dimension,
            int batchSize) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public List<Optional<float[]>> embed(List<String> texts) throws IOException {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<Optional<float[]>> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            int to = Math.min(texts.size(), from + batchSize);
            out.addAll(embedBatch(texts.subList(from, to)));
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private List<Optional<float[]>> embedBatch(List<String> batch) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        ArrayNode input = payload.putArray("input");
        batch.forEach(input::add);

        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Embeddings endpoint returned " + response.code() + ": " + text);
            }
            return parse(mapper.readTree(text), batch.size());
        }
    }

    private List<Optional<float[]>> parse(JsonNode root, int expected) {
        List<Optional<float[]>> slots = new ArrayList<>(Collections.nCopies(expected, Optional.empty()));
        JsonNode data = root.path("data");
        if (data.isArray()) {
            for (int position = 0; position < data.size(); position++) {
                JsonNode item = data.get(position);
                int index = item.path("index").asInt(position);
                if (index >= 0 && index < expected) {
                    slots.set(index, toVector(item.path("embedding")));
                }
            }
        } else if (root.path("embeddings").isArray()) {
            JsonNode embeddings = root.path("embeddings");
            for (int index = 0; index < Math.min(expected, embeddings.size()); index++) {
                slots.set(index, toVector(embeddings.get(index)));
            }
        }
        long missing = slots.stream().filter(Optional::isEmpty).count();
        if (missing > 0) {
            log.warn("Embeddings endpoint returned no usable vector for {} of {} inputs", missing, expected);
        }
        return slots;
    }

    private Optional<float[]> toVector(JsonNode vectorNode) {
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            return Optional.empty();
        }
        if (dimension > 0 && vectorNode.size() != dimension) {
            log.warn("Discarding embedding of length {} (expected {})", vectorNode.size(), dimension);
            return Optional.empty();
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return Optional.of(out);
    }

    @Override
    public String toString() {
        return "HttpEmbeddingClient{" +
                "endpoint=" + endpoint +
                ", model=" + model +
                ", batchSize=" + batchSize +
                '}';
    }
}

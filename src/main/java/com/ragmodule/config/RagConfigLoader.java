package com.ragmodule.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragmodule.ConfigurationException;
import com.ragmodule.chunking.ChunkingConfig;
import com.ragmodule.chunking.ChunkingStrategy;
import com.ragmodule.embedding.EmbeddingProviderType;
import com.ragmodule.embedding.EmbeddingsConfig;
import com.ragmodule.store.DistanceMetric;

public class RagConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public RagConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return new RagConfig();
        }
        RagConfig config = mapper.readValue(path.toFile(), RagConfig.class);
        return config == null ? new RagConfig() : config;
    }

    public RagConfig load(Path path, Map<String, String> environment) throws IOException {
        return applyEnvironment(load(path), environment);
    }

    public RagConfig applyEnvironment(RagConfig config, Map<String, String> env) {
        String provider = value(env, "RAG_PROVIDER");
        if (provider != null) {
            config.setProvider(parse("RAG_PROVIDER", provider, ProviderType::fromString));
        }

        if (hasAny(env, "QDRANT_URL", "QDRANT_API_KEY", "QDRANT_COLLECTION_NAME", "QDRANT_VECTOR_SIZE", "QDRANT_DISTANCE_METRIC")) {
            QdrantConfig qdrant = config.getQdrant() == null ? new QdrantConfig() : config.getQdrant();
            ifPresent(env, "QDRANT_URL", qdrant::setUrl);
            ifPresent(env, "QDRANT_API_KEY", qdrant::setApiKey);
            ifPresent(env, "QDRANT_COLLECTION_NAME", qdrant::setCollectionName);
            ifPresent(env, "QDRANT_VECTOR_SIZE", v -> qdrant.setVectorSize(parseInt("QDRANT_VECTOR_SIZE", v)));
            ifPresent(env, "QDRANT_DISTANCE_METRIC",
                    v -> qdrant.setDistanceMetric(parse("QDRANT_DISTANCE_METRIC", v, DistanceMetric::fromString)));
            config.setQdrant(qdrant);
        }

        if (hasAny(env, "EMBEDDINGS_PROVIDER", "EMBEDDINGS_ENDPOINT", "EMBEDDINGS_API_KEY", "EMBEDDINGS_MODEL", "EMBEDDINGS_DIMENSION")) {
            EmbeddingsConfig embeddings = config.getEmbeddings() == null ? new EmbeddingsConfig() : config.getEmbeddings();
            ifPresent(env, "EMBEDDINGS_PROVIDER",
                    v -> embeddings.setProviderType(parse("EMBEDDINGS_PROVIDER", v, EmbeddingProviderType::fromString)));
            ifPresent(env, "EMBEDDINGS_ENDPOINT", embeddings::setEndpoint);
            ifPresent(env, "EMBEDDINGS_API_KEY", embeddings::setApiKey);
            ifPresent(env, "EMBEDDINGS_MODEL", embeddings::setModel);
            ifPresent(env, "EMBEDDINGS_DIMENSION", v -> embeddings.setDimension(parseInt("EMBEDDINGS_DIMENSION", v)));
            config.setEmbeddings(embeddings);
        }

        if (hasAny(env, "CHUNKING_STRATEGY", "CHUNKING_SIZE", "CHUNKING_OVERLAP")) {
            ChunkingConfig chunking = config.getChunking() == null ? new ChunkingConfig() : config.getChunking();
            ifPresent(env, "CHUNKING_STRATEGY",
                    v -> chunking.setStrategy(parse("CHUNKING_STRATEGY", v, ChunkingStrategy::fromString)));
            ifPresent(env, "CHUNKING_SIZE", v -> chunking.setChunkSize(parseInt("CHUNKING_SIZE", v)));
            ifPresent(env, "CHUNKING_OVERLAP", v -> chunking.setChunkOverlap(parseInt("CHUNKING_OVERLAP", v)));
            config.setChunking(chunking);
        }

        ifPresent(env, "RAG_DEFAULT_LIMIT", v -> config.setDefaultRetrievalLimit(parseInt("RAG_DEFAULT_LIMIT", v)));
        ifPresent(env, "RAG_DEFAULT_SCORE_THRESHOLD",
                v -> config.setDefaultScoreThreshold(parseDouble("RAG_DEFAULT_SCORE_THRESHOLD", v)));
        ifPresent(env, "DEBUG", v -> config.setDebug(Boolean.parseBoolean(v)));
        return config;
    }

    private static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean hasAny(Map<String, String> env, String... names) {
        for (String name : names) {
            if (value(env, name) != null) {
                return true;
            }
        }
        return false;
    }

    private static void ifPresent(Map<String, String> env, String name, Consumer<String> setter) {
        String value = value(env, name);
        if (value != null) {
            setter.accept(value);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a valid number, got '" + value + "'", e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a valid number, got '" + value + "'", e);
        }
    }

    private static <T> T parse(String name, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid " + name + ": " + e.getMessage(), e);
        }
    }
}

package com.ragmodule.store;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class QdrantRestClient implements VectorStoreClient {
    private static final Logger log = LoggerFactory.getLogger(QdrantRestClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final String apiKey;

    public QdrantRestClient(String url, String apiKey, Duration timeout) {
        this(new OkHttpClient.Builder().callTimeout(timeout).build(), url, apiKey);
    }

    public QdrantRestClient(OkHttpClient httpClient, String url, String apiKey) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Qdrant url: " + url);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = parsed;
        this.apiKey = apiKey;
    }

    @Override
    public List<String> listCollections() throws IOException {
        JsonNode result = execute("GET", url("collections"), null);
        List<String> names = new ArrayList<>();
        for (JsonNode collection : result.path("collections")) {
            names.add(collection.path("name").asText());
        }
        return names;
    }

    @Override
    public CollectionInfo getCollection(String collection) throws IOException {
        JsonNode result = execute("GET", url("collections", collection), null);
        JsonNode vectors = result.path("config").path("params").path("vectors");
        return new CollectionInfo(collection, vectors.path("size").asInt(), distance(vectors.path("distance")));
    }

    // Null for a distance this client has no constant for, e.g. Manhattan.
    private static DistanceMetric distance(JsonNode distanceNode) {
        if (!distanceNode.isTextual()) {
            return null;
        }
        try {
            return DistanceMetric.fromString(distanceNode.asText());
        } catch (IllegalArgumentException e) {
            log.warn("Collection uses unsupported distance {}", distanceNode.asText());
            return null;
        }
    }

    @Override
    public void createCollection(String collection, int vectorSize, DistanceMetric distance) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode vectors = root.putObject("vectors");
        vectors.put("size", vectorSize);
        vectors.put("distance", distance.wireName());
        execute("PUT", url("collections", collection), root);
    }

    @Override
    public boolean deleteCollection(String collection) throws IOException {
        JsonNode result = execute("DELETE", url("collections", collection), null);
        return result.asBoolean(true);
    }

    @Override
    public void upsert(String collection, List<Point> points, boolean wait) throws IOException {
        ArrayNode pointsArray = mapper.createArrayNode();
        for (Point point : points) {
            ObjectNode pointNode = pointsArray.addObject();
            putId(pointNode, "id", point.id());
            ArrayNode vectorNode = pointNode.putArray("vector");
            for (float v : point.vector()) {
                vectorNode.add(v);
            }
            pointNode.set("payload", mapper.valueToTree(point.payload()));
        }
        ObjectNode root = mapper.createObjectNode();
        root.set("points", pointsArray);
        execute("PUT", waitUrl(wait, "collections", collection, "points"), root);
    }

    @Override
    public List<ScoredPoint> search(String collection, SearchRequest request) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode vectorNode = root.putArray("vector");
        for (float v : request.vector()) {
            vectorNode.add(v);
        }
        root.put("limit", request.limit());
        if (request.scoreThreshold() != null) {
            root.put("score_threshold", request.scoreThreshold());
        }
        if (request.filter() != null && !request.filter().isEmpty()) {
            root.set("filter", filterNode(request.filter()));
        }
        root.put("with_payload", request.withPayload());
        root.put("with_vector", request.withVector());

        JsonNode result = execute("POST", url("collections", collection, "points", "search"), root);
        List<ScoredPoint> hits = new ArrayList<>();
        for (JsonNode hit : result) {
            hits.add(new ScoredPoint(hit.path("id").asText(), hit.path("score").asDouble(), payload(hit)));
        }
        return hits;
    }

    @Override
    public void deletePoints(String collection, List<String> ids, boolean wait) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode idsNode = root.putArray("points");
        for (String id : ids) {
            addId(idsNode, id);
        }
        execute("POST", waitUrl(wait, "collections", collection, "points", "delete"), root);
    }

    @Override
    public void deleteByFilter(String collection, PointFilter filter, boolean wait) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.set("filter", filterNode(filter));
        execute("POST", waitUrl(wait, "collections", collection, "points", "delete"), root);
    }

    @Override
    public ScrollPage scroll(String collection, ScrollRequest request) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        if (request.filter() != null && !request.filter().isEmpty()) {
            root.set("filter", filterNode(request.filter()));
        }
        root.put("limit", request.limit());
        if (request.offset() != null) {
            putId(root, "offset", request.offset());
        }
        root.put("with_payload", request.withPayload());
        root.put("with_vector", request.withVector());

        JsonNode result = execute("POST", url("collections", collection, "points", "scroll"), root);
        List<Point> points = new ArrayList<>();
        for (JsonNode pointNode : result.path("points")) {
            points.add(new Point(pointNode.path("id").asText(), vector(pointNode.path("vector")), payload(pointNode)));
        }
        JsonNode next = result.path("next_page_offset");
        return new ScrollPage(points, next.isMissingNode() || next.isNull() ? null : next.asText());
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private JsonNode execute(String method, HttpUrl url, JsonNode body) throws IOException {
        RequestBody requestBody = body == null ? null : RequestBody.create(mapper.writeValueAsString(body), JSON);
        Request.Builder builder = new Request.Builder()
                .url(url)
                .method(method, requestBody);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        log.trace("{} {}", method, url);

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new QdrantException(response.code(), errorMessage(response.code(), text));
            }
            if (text.isBlank()) {
                return mapper.missingNode();
            }
            return mapper.readTree(text).path("result");
        }
    }

    private String errorMessage(int code, String body) {
        try {
            JsonNode error = mapper.readTree(body).path("status").path("error");
            if (error.isTextual()) {
                return error.asText() + " (HTTP " + code + ")";
            }
        } catch (IOException e) {
            log.debug("Qdrant error body is not JSON: {}", body);
        }
        return "HTTP " + code + (body.isBlank() ? "" : ": " + body);
    }

    private ObjectNode filterNode(PointFilter filter) {
        ObjectNode filterNode = mapper.createObjectNode();
        ArrayNode must = filterNode.putArray("must");
        for (PointFilter.FieldCondition condition : filter.must()) {
            ObjectNode conditionNode = must.addObject();
            conditionNode.put("key", condition.key());
            conditionNode.putObject("match").set("value", mapper.valueToTree(condition.value()));
        }
        return filterNode;
    }

    private Map<String, Object> payload(JsonNode pointNode) {
        JsonNode payloadNode = pointNode.path("payload");
        if (!payloadNode.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(payloadNode, PAYLOAD_TYPE);
    }

    private static float[] vector(JsonNode vectorNode) {
        if (!vectorNode.isArray()) {
            return null;
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }

    // Qdrant point ids are either unsigned integers or UUID strings.
    private static void putId(ObjectNode node, String field, String id) {
        if (isNumericId(id)) {
            node.put(field, Long.parseLong(id));
        } else {
            node.put(field, id);
        }
    }

    private static void addId(ArrayNode node, String id) {
        if (isNumericId(id)) {
            node.add(Long.parseLong(id));
        } else {
            node.add(id);
        }
    }

    private static boolean isNumericId(String id) {
        return !id.isEmpty() && id.length() < 19 && id.chars().allMatch(Character::isDigit);
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private HttpUrl waitUrl(boolean wait, String... segments) {
        return url(segments).newBuilder()
                .addQueryParameter("wait", Boolean.toString(wait))
                .build();
    }

    @Override
    public String toString() {
        return "QdrantRestClient{" +
                "baseUrl=" + baseUrl +
                '}';
    }
}

package com.ragmodule.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-process store used in place of a Qdrant server. Scroll pages walk points in id order.
 */
public class InMemoryVectorStoreClient implements VectorStoreClient {

    private final Map<String, StoredCollection> collections = new LinkedHashMap<>();
    private int maxScrollPageSize = Integer.MAX_VALUE;
    private boolean failUpserts;
    private boolean reportMissingDeleteAsError = true;
    private boolean failListing;

    public int createCalls;
    public int upsertCalls;
    public int searchCalls;
    public int deleteCalls;
    public int scrollCalls;
    public int closeCalls;

    private static final class StoredCollection {
        final int vectorSize;
        final DistanceMetric distance;
        final TreeMap<String, Point> points = new TreeMap<>();

        StoredCollection(int vectorSize, DistanceMetric distance) {
            this.vectorSize = vectorSize;
            this.distance = distance;
        }
    }

    public InMemoryVectorStoreClient withCollection(String name, int vectorSize, DistanceMetric distance) {
        collections.put(name, new StoredCollection(vectorSize, distance));
        return this;
    }

    public InMemoryVectorStoreClient withMaxScrollPageSize(int maxScrollPageSize) {
        this.maxScrollPageSize = maxScrollPageSize;
        return this;
    }

    public InMemoryVectorStoreClient failingUpserts() {
        this.failUpserts = true;
        return this;
    }

    public InMemoryVectorStoreClient failingListing() {
        this.failListing = true;
        return this;
    }

    /**
     * Makes {@link #deleteCollection} return false for a missing collection instead of answering 404.
     */
    public InMemoryVectorStoreClient reportingMissingDeleteAsFalse() {
        this.reportMissingDeleteAsError = false;
        return this;
    }

    public int pointCount(String collection) {
        StoredCollection stored = collections.get(collection);
        return stored == null ? 0 : stored.points.size();
    }

    public boolean hasCollection(String collection) {
        return collections.containsKey(collection);
    }

    @Override
    public synchronized List<String> listCollections() throws IOException {
        if (failListing) {
            throw new IOException("Connection refused");
        }
        return new ArrayList<>(collections.keySet());
    }

    @Override
    public synchronized CollectionInfo getCollection(String collection) throws IOException {
        StoredCollection stored = require(collection);
        return new CollectionInfo(collection, stored.vectorSize, stored.distance);
    }

    @Override
    public synchronized void createCollection(String collection, int vectorSize, DistanceMetric distance) {
        createCalls++;
        collections.put(collection, new StoredCollection(vectorSize, distance));
    }

    @Override
    public synchronized boolean deleteCollection(String collection) throws IOException {
        deleteCalls++;
        if (collections.remove(collection) != null) {
            return true;
        }
        if (reportMissingDeleteAsError) {
            throw new QdrantException(404, "Collection `" + collection + "` doesn't exist!");
        }
        return false;
    }

    @Override
    public synchronized void upsert(String collection, List<Point> points, boolean wait) throws IOException {
        upsertCalls++;
        if (failUpserts) {
            throw new QdrantException(500, "Service internal error: disk full");
        }
        StoredCollection stored = require(collection);
        for (Point point : points) {
            if (point.vector().length != stored.vectorSize) {
                throw new QdrantException(400, "Wrong input: Vector dimension error: expected dim: "
                        + stored.vectorSize + ", got " + point.vector().length);
            }
            stored.points.put(point.id(), point);
        }
    }

    @Override
    public synchronized List<ScoredPoint> search(String collection, SearchRequest request) throws IOException {
        searchCalls++;
        StoredCollection stored = require(collection);
        boolean ascending = stored.distance == DistanceMetric.EUCLID;
        List<ScoredPoint> hits = new ArrayList<>();
        for (Point point : stored.points.values()) {
            if (!request.filter().matches(point.payload())) {
                continue;
            }
            double score = score(stored.distance, request.vector(), point.vector());
            if (request.scoreThreshold() != null
                    && (ascending ? score > request.scoreThreshold() : score < request.scoreThreshold())) {
                continue;
            }
            hits.add(new ScoredPoint(point.id(), score, request.withPayload() ? point.payload() : Map.of()));
        }
        Comparator<ScoredPoint> byScore = Comparator.comparingDouble(ScoredPoint::score);
        hits.sort(ascending ? byScore : byScore.reversed());
        return hits.size() > request.limit() ? new ArrayList<>(hits.subList(0, request.limit())) : hits;
    }

    @Override
    public synchronized void deletePoints(String collection, List<String> ids, boolean wait) throws IOException {
        deleteCalls++;
        StoredCollection stored = require(collection);
        ids.forEach(stored.points::remove);
    }

    @Override
    public synchronized void deleteByFilter(String collection, PointFilter filter, boolean wait) throws IOException {
        deleteCalls++;
        StoredCollection stored = require(collection);
        stored.points.values().removeIf(point -> filter.matches(point.payload()));
    }

    @Override
    public synchronized ScrollPage scroll(String collection, ScrollRequest request) throws IOException {
        scrollCalls++;
        StoredCollection stored = require(collection);
        int pageSize = Math.min(request.limit(), maxScrollPageSize);
        Map<String, Point> remaining = request.offset() == null
                ? stored.points
                : stored.points.tailMap(request.offset(), true);
        List<Point> page = new ArrayList<>();
        String next = null;
        for (Point point : remaining.values()) {
            if (!request.filter().matches(point.payload())) {
                continue;
            }
            if (page.size() == pageSize) {
                next = point.id();
                break;
            }
            page.add(new Point(
                    point.id(),
                    request.withVector() ? point.vector() : null,
                    request.withPayload() ? point.payload() : Map.of()));
        }
        return new ScrollPage(page, next);
    }

    @Override
    public void close() {
        closeCalls++;
    }

    private StoredCollection require(String collection) throws QdrantException {
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            throw new QdrantException(404, "Not found: Collection `" + collection + "` doesn't exist!");
        }
        return stored;
    }

    private static double score(DistanceMetric metric, float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        double squaredDistance = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
            double diff = a[i] - b[i];
            squaredDistance += diff * diff;
        }
        return switch (metric) {
            case COSINE -> normA == 0 || normB == 0 ? 0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
            case DOT -> dot;
            case EUCLID -> Math.sqrt(squaredDistance);
        };
    }
}

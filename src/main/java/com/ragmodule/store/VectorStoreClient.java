package com.ragmodule.store;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * CRUD and similarity search over named collections of points.
 */
public interface VectorStoreClient extends Closeable {
    List<String> listCollections() throws IOException;

    CollectionInfo getCollection(String collection) throws IOException;

    void createCollection(String collection, int vectorSize, DistanceMetric distance) throws IOException;

    /**
     * @return false when the backend reports nothing was deleted
     */
    boolean deleteCollection(String collection) throws IOException;

    void upsert(String collection, List<Point> points, boolean wait) throws IOException;

    /**
     * @return hits ordered by descending score
     */
    List<ScoredPoint> search(String collection, SearchRequest request) throws IOException;

    void deletePoints(String collection, List<String> ids, boolean wait) throws IOException;

    void deleteByFilter(String collection, PointFilter filter, boolean wait) throws IOException;

    ScrollPage scroll(String collection, ScrollRequest request) throws IOException;

    @Override
    default void close() {
    }
}

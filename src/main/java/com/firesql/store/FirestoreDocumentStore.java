package com.firesql.store;

import com.firesql.domain.Document;
import com.firesql.query.SortDirection;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * {@link DocumentStore} backed by a Cloud Firestore client.
 * Firestore timestamps are converted to {@link Instant}, including inside nested maps and arrays.
 */
public class FirestoreDocumentStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(FirestoreDocumentStore.class);

    private final Firestore client;

    public FirestoreDocumentStore(Firestore client) {
        this.client = client;
    }

    @Override
    public List<Document> query(String collection, List<StoreFilter> filters, StoreOrder order, int limit) {
        if (collection == null || collection.isEmpty()) {
            throw new StoreException("collection name is required");
        }

        Query query = client.collection(collection);
        for (StoreFilter filter : filters) {
            query = applyFilter(query, filter);
        }
        if (order != null) {
            query = query.orderBy(order.getField(),
                order.getDirection() == SortDirection.DESC ? Query.Direction.DESCENDING : Query.Direction.ASCENDING);
        }
        if (limit > 0) {
            query = query.limit(limit);
        }

        try {
            List<QueryDocumentSnapshot> snapshots = query.get().get().getDocuments();
            List<Document> documents = new ArrayList<>(snapshots.size());
            for (QueryDocumentSnapshot snapshot : snapshots) {
                documents.add(new Document(normalizeMap(snapshot.getData())));
            }
            logger.debug("Retrieved {} documents from {}", documents.size(), collection);
            return documents;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Firestore query on {} failed: {}", collection, cause.getMessage());
            throw new StoreException(cause.getMessage(), cause);
        } catch (IllegalArgumentException e) {
            throw new StoreException(e.getMessage(), e);
        }
    }

    private static Query applyFilter(Query query, StoreFilter filter) {
        String field = filter.getField();
        Object value = toStoreValue(filter.getValue());
        switch (filter.getOperator()) {
            case EQ:
                return query.whereEqualTo(field, value);
            case NEQ:
                return query.whereNotEqualTo(field, value);
            case LT:
                return query.whereLessThan(field, value);
            case LTE:
                return query.whereLessThanOrEqualTo(field, value);
            case GT:
                return query.whereGreaterThan(field, value);
            case GTE:
                return query.whereGreaterThanOrEqualTo(field, value);
            default:
                throw new StoreException("unsupported operator " + filter.getOperator());
        }
    }

    private static Object toStoreValue(Object value) {
        if (value instanceof Instant) {
            Instant instant = (Instant) value;
            return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
        }
        return value;
    }

    static Map<String, Object> normalizeMap(Map<String, Object> data) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (data == null) {
            return normalized;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            normalized.put(entry.getKey(), normalize(entry.getValue()));
        }
        return normalized;
    }

    @SuppressWarnings("unchecked")
    static Object normalize(Object value) {
        if (value instanceof Timestamp) {
            Timestamp ts = (Timestamp) value;
            return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
        }
        if (value instanceof Map) {
            return normalizeMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                items.add(normalize(item));
            }
            return items;
        }
        return value;
    }
}

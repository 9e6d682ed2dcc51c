package com.firesql.store;

import com.firesql.domain.Document;

import java.util.List;

/**
 * Read access to a schemaless document store.
 */
public interface DocumentStore {

    /**
     * Query a collection with store-side filters, ordering and limit.
     *
     * @param collection collection name
     * @param filters filters evaluated by the store, ANDed
     * @param order ordering, or null for store order
     * @param limit maximum documents to return, 0 for no limit
     * @return matching documents, timestamps normalized to {@link java.time.Instant}
     * @throws StoreException if the store rejects or fails the query
     */
    List<Document> query(String collection, List<StoreFilter> filters, StoreOrder order, int limit)
        throws StoreException;
}

package com.firesql.store;

import com.firesql.domain.Document;
import com.firesql.query.SortDirection;
import com.google.api.core.ApiFutures;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the Firestore adapter
 */
@ExtendWith(MockitoExtension.class)
class FirestoreDocumentStoreTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-02T00:00:00Z");

    @Mock
    private Firestore client;

    @Mock
    private CollectionReference collection;

    @Mock
    private Query bounded;

    @Mock
    private Query fullyBounded;

    @Mock
    private Query ordered;

    @Mock
    private Query limited;

    @Mock
    private QuerySnapshot snapshot;

    @Mock
    private QueryDocumentSnapshot documentSnapshot;

    private FirestoreDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new FirestoreDocumentStore(client);
    }

    private static Timestamp timestamp(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    @Test
    void testQuery_AppliesFiltersOrderAndLimit() {
        // Given: A chain of store queries returning one document with nested timestamps
        when(client.collection("logs")).thenReturn(collection);
        when(collection.whereGreaterThanOrEqualTo("ts", timestamp(FROM))).thenReturn(bounded);
        when(bounded.whereLessThanOrEqualTo("ts", timestamp(TO))).thenReturn(fullyBounded);
        when(fullyBounded.orderBy("ts", Query.Direction.DESCENDING)).thenReturn(ordered);
        when(ordered.limit(5)).thenReturn(limited);
        when(limited.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(snapshot.getDocuments()).thenReturn(List.of(documentSnapshot));

        Map<String, Object> data = new HashMap<>();
        data.put("ts", timestamp(FROM));
        data.put("meta", Map.of("seen", List.of(timestamp(TO))));
        data.put("level", "info");
        when(documentSnapshot.getData()).thenReturn(data);

        // When: Querying
        List<Document> documents = store.query("logs",
            List.of(new StoreFilter("ts", StoreOperator.GTE, FROM), new StoreFilter("ts", StoreOperator.LTE, TO)),
            new StoreOrder("ts", SortDirection.DESC),
            5);

        // Then: Timestamps are normalized at every depth
        assertThat(documents).hasSize(1);
        Document document = documents.get(0);
        assertThat(document.resolve("ts").raw()).isEqualTo(FROM);
        assertThat(document.resolve("level").asText()).isEqualTo("info");
        assertThat(document.getData().get("meta")).isEqualTo(Map.of("seen", List.of(TO)));
    }

    @Test
    void testQuery_MapsEveryOperator() {
        when(client.collection("c")).thenReturn(collection);
        when(collection.whereEqualTo("a", 1L)).thenReturn(bounded);
        when(bounded.whereNotEqualTo("b", "x")).thenReturn(fullyBounded);
        when(fullyBounded.whereLessThan("c", 2.5)).thenReturn(ordered);
        when(ordered.whereGreaterThan("d", true)).thenReturn(limited);
        when(limited.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(snapshot.getDocuments()).thenReturn(List.of());

        List<Document> documents = store.query("c", List.of(
            new StoreFilter("a", StoreOperator.EQ, 1L),
            new StoreFilter("b", StoreOperator.NEQ, "x"),
            new StoreFilter("c", StoreOperator.LT, 2.5),
            new StoreFilter("d", StoreOperator.GT, true)), null, 0);

        assertThat(documents).isEmpty();
        verify(limited, never()).limit(anyInt());
    }

    @Test
    void testQuery_StoreFailure_RaisesStoreException() {
        when(client.collection("c")).thenReturn(collection);
        when(collection.get()).thenReturn(ApiFutures.immediateFailedFuture(
            new IllegalStateException("PERMISSION_DENIED: missing permissions")));

        assertThatThrownBy(() -> store.query("c", List.of(), null, 0))
            .isInstanceOf(StoreException.class)
            .hasMessage("PERMISSION_DENIED: missing permissions");
    }

    @Test
    void testQuery_RequiresCollection() {
        assertThatThrownBy(() -> store.query("", List.of(), null, 0))
            .isInstanceOf(StoreException.class)
            .hasMessage("collection name is required");
        verifyNoInteractions(client);
    }

    @Test
    void testNormalize_LeavesOtherValuesAlone() {
        assertThat(FirestoreDocumentStore.normalize("x")).isEqualTo("x");
        assertThat(FirestoreDocumentStore.normalize(3L)).isEqualTo(3L);
        assertThat(FirestoreDocumentStore.normalize(null)).isNull();
        assertThat(FirestoreDocumentStore.normalizeMap(null)).isEmpty();
    }
}

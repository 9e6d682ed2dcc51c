package com.firesql.query;

import com.firesql.delegate.SqlExecutor;
import com.firesql.domain.DataResponse;
import com.firesql.domain.Document;
import com.firesql.domain.ErrorStatus;
import com.firesql.domain.ExecutionResult;
import com.firesql.domain.FieldType;
import com.firesql.domain.Frame;
import com.firesql.domain.FrameField;
import com.firesql.domain.TimeWindow;
import com.firesql.store.DatasourceSettings;
import com.firesql.store.DocumentStore;
import com.firesql.store.DocumentStoreFactory;
import com.firesql.store.StoreException;
import com.firesql.store.StoreFilter;
import com.firesql.store.StoreOperator;
import com.firesql.store.StoreOrder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for QueryExecutor
 * Covers routing, the native plan path, the delegated path with its deadline
 * and row cap, and the per-query recovery boundary
 */
@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {

    private static final DatasourceSettings SETTINGS = new DatasourceSettings("demo-project", null);
    private static final Instant T1 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T12:05:00Z");

    @Mock
    private DocumentStoreFactory storeFactory;

    @Mock
    private DocumentStore store;

    @Mock
    private SqlExecutor sqlExecutor;

    @Mock
    private QueryMetrics metrics;

    private final List<QueryExecutor> created = new ArrayList<>();
    private QueryExecutor queryExecutor;

    @BeforeEach
    void setUp() {
        queryExecutor = newExecutor(SETTINGS, Duration.ofSeconds(30), 10000);
    }

    @AfterEach
    void tearDown() {
        created.forEach(QueryExecutor::shutdown);
    }

    private QueryExecutor newExecutor(DatasourceSettings settings, Duration timeout, int maxDelegatedRows) {
        QueryDiagnostics diagnostics = QueryDiagnostics.NOOP;
        QueryExecutor executor = new QueryExecutor(
            new QueryParser(diagnostics),
            new QueryRouter(),
            new DocumentFilter(diagnostics),
            new GroupAggregator(diagnostics),
            new ResultMaterializer(),
            storeFactory,
            sqlExecutor,
            settings,
            metrics,
            timeout,
            maxDelegatedRows,
            10000);
        created.add(executor);
        return executor;
    }

    private static FrameField column(DataResponse response, String name) {
        assertThat(response.getFrames()).hasSize(1);
        Frame frame = response.getFrames().get(0);
        return frame.field(name).orElseThrow(() -> new AssertionError("missing column " + name));
    }

    // ========== Native Path Tests ==========

    @Test
    void testExecute_GroupByQuery_AggregatesInMemory() {
        // Given: Orders in two regions; the query groups the EU ones by status
        when(storeFactory.connect(SETTINGS)).thenReturn(store);
        when(store.query(eq("orders"), eq(List.of()), isNull(), eq(10000))).thenReturn(List.of(
            new Document(Map.of("status", "open", "amt", 10L, "region", "eu")),
            new Document(Map.of("status", "open", "amt", 30L, "region", "eu")),
            new Document(Map.of("status", "closed", "amt", 5L, "region", "eu")),
            new Document(Map.of("status", "closed", "amt", 500L, "region", "us"))));

        QueryRequest request = QueryRequest.of(
            "SELECT status, SUM(amt) as total FROM orders WHERE region = 'eu' "
                + "GROUP BY status ORDER BY total DESC LIMIT 5",
            TimeWindow.NONE);

        // When: Executing
        // Then: ORDER BY and LIMIT are not pushed down; rows come back sorted
        StepVerifier.create(queryExecutor.execute(request))
            .assertNext(response -> {
                assertThat(response.hasError()).isFalse();
                assertThat(column(response, "status").getValues()).containsExactly("open", "closed");
                assertThat(column(response, "total").getType()).isEqualTo(FieldType.FLOAT64);
                assertThat(column(response, "total").getValues()).containsExactly(40.0, 5.0);
            })
            .verifyComplete();

        verify(metrics).recordRoute(ExecutionPath.NATIVE);
        verify(metrics).recordDocumentsRetrieved(4);
        verifyNoInteractions(sqlExecutor);
    }

    @Test
    void testExecute_TimeRangeQuery_PushesDownBoundsOrderAndLimit() {
        // Given: A time-range query with an in-memory equality filter
        when(storeFactory.connect(SETTINGS)).thenReturn(store);
        when(store.query(any(), anyList(), any(), anyInt())).thenReturn(List.of(
            new Document(Map.of("ts", T2, "level", "error")),
            new Document(Map.of("ts", T1, "level", "warn"))));

        QueryRequest request = new QueryRequest("A",
            "SELECT ts, level FROM logs WHERE ts >= $__from AND ts <= $__to AND level = 'error' "
                + "ORDER BY ts DESC LIMIT 50",
            "ts",
            TimeWindow.ofEpochMillis(1000L, 2000L));

        // When: Executing
        StepVerifier.create(queryExecutor.execute(request))
            .assertNext(response -> {
                assertThat(column(response, "ts").getType()).isEqualTo(FieldType.TIME);
                assertThat(column(response, "ts").getValues()).containsExactly(T2);
                assertThat(column(response, "level").getValues()).containsExactly("error");
            })
            .verifyComplete();

        // Then: Time bounds, ordering and limit reach the store; the equality filter does not
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StoreFilter>> filters = ArgumentCaptor.forClass(List.class);
        verify(store).query(eq("logs"), filters.capture(), eq(new StoreOrder("ts", SortDirection.DESC)), eq(50));
        assertThat(filters.getValue()).containsExactly(
            new StoreFilter("ts", StoreOperator.GTE, Instant.ofEpochMilli(1000L)),
            new StoreFilter("ts", StoreOperator.LTE, Instant.ofEpochMilli(2000L)));
    }

    @Test
    void testExecute_PlanWithoutTimeField_UsesRequestTimeField() {
        // Given: Time variables the parser cannot attach to a field, and a time field on the request
        when(storeFactory.connect(SETTINGS)).thenReturn(store);
        when(store.query(eq("logs"), eq(List.of()), isNull(), eq(10000))).thenReturn(List.of(
            new Document(Map.of("ts", T1, "level", "warn"))));

        QueryRequest request = new QueryRequest("A",
            "SELECT ts, level FROM logs WHERE $__from <= ts AND $__to >= ts",
            "ts",
            TimeWindow.ofEpochMillis(1000L, 2000L));

        // When: Executing
        // Then: The request's time field types the column; no bounds were pushed down
        StepVerifier.create(queryExecutor.execute(request))
            .assertNext(response -> {
                assertThat(response.hasError()).isFalse();
                assertThat(column(response, "ts").getType()).isEqualTo(FieldType.TIME);
                assertThat(column(response, "ts").getValues()).containsExactly(T1);
                assertThat(column(response, "level").getType()).isEqualTo(FieldType.STRING);
            })
            .verifyComplete();
    }

    @Test
    void testTimeField_PlanFieldWinsOverRequestField() {
        QueryParser parser = new QueryParser(QueryDiagnostics.NOOP);
        QueryPlan withTime = parser.parse("SELECT ts FROM logs WHERE ts >= $__from AND ts <= $__to");
        QueryPlan withoutTime = parser.parse("SELECT created FROM logs");
        QueryRequest request = new QueryRequest("A", "ignored", "created", TimeWindow.NONE);

        assertThat(QueryExecutor.timeField(withTime, request)).isEqualTo("ts");
        assertThat(QueryExecutor.timeField(withoutTime, request)).isEqualTo("created");
    }

    @Test
    void testExecute_NativeParseError_ReturnsBadRequest() {
        // Given: A GROUP BY query without FROM
        QueryRequest request = QueryRequest.of("SELECT status GROUP BY status", TimeWindow.NONE);

        // When/Then: The parse error becomes a bad request for this query
        StepVerifier.create(queryExecutor.execute(request))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.BAD_REQUEST);
                assertThat(response.getError()).isEqualTo("missing SELECT or FROM");
                assertThat(response.getFrames()).isEmpty();
            })
            .verifyComplete();

        verify(metrics).recordQueryFailed();
        verifyNoInteractions(storeFactory);
    }

    @Test
    void testExecute_StoreFailure_ReturnsBadRequest() {
        when(storeFactory.connect(SETTINGS)).thenReturn(store);
        when(store.query(any(), anyList(), any(), anyInt()))
            .thenThrow(new StoreException("FAILED_PRECONDITION: the query requires an index"));

        StepVerifier.create(queryExecutor.execute(
                QueryRequest.of("SELECT k, COUNT(*) FROM c GROUP BY k", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.BAD_REQUEST);
                assertThat(response.getError()).isEqualTo("FAILED_PRECONDITION: the query requires an index");
            })
            .verifyComplete();
    }

    // ========== Delegated Path Tests ==========

    @Test
    void testExecute_PlainQuery_IsDelegatedVerbatim() {
        String query = "SELECT name, age FROM users WHERE age > 30";
        List<List<Object>> records = new ArrayList<>();
        records.add(List.of("ada", 36L));
        records.add(List.of("linus", 54L));
        when(sqlExecutor.execute(SETTINGS, query)).thenReturn(new ExecutionResult(List.of("name", "age"), records));

        StepVerifier.create(queryExecutor.execute(QueryRequest.of(query, TimeWindow.ofEpochMillis(1000L, 2000L))))
            .assertNext(response -> {
                assertThat(column(response, "name").getType()).isEqualTo(FieldType.STRING);
                assertThat(column(response, "age").getType()).isEqualTo(FieldType.INT64);
                assertThat(column(response, "age").getValues()).containsExactly(36L, 54L);
            })
            .verifyComplete();

        verify(metrics).recordRoute(ExecutionPath.DELEGATED);
        verifyNoInteractions(storeFactory);
    }

    @Test
    void testExecute_TimeVariablesWithoutWindow_AreDelegated() {
        String query = "SELECT * FROM logs WHERE ts >= $__from AND ts <= $__to";
        when(sqlExecutor.execute(SETTINGS, query)).thenReturn(new ExecutionResult(List.of("ts"), List.of()));

        StepVerifier.create(queryExecutor.execute(QueryRequest.of(query, TimeWindow.NONE)))
            .assertNext(response -> assertThat(response.hasError()).isFalse())
            .verifyComplete();

        verify(sqlExecutor).execute(SETTINGS, query);
    }

    @Test
    void testExecute_DelegatedResultOverCap_IsTruncated() {
        // Given: A row cap of 2 and three records
        QueryExecutor capped = newExecutor(SETTINGS, Duration.ofSeconds(30), 2);
        List<List<Object>> records = List.of(List.of(1L), List.of(2L), List.of(3L));
        when(sqlExecutor.execute(any(), any())).thenReturn(new ExecutionResult(List.of("n"), records));

        // When/Then: Excess rows are dropped, not reported as an error
        StepVerifier.create(capped.execute(QueryRequest.of("SELECT n FROM c", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.hasError()).isFalse();
                assertThat(column(response, "n").getValues()).containsExactly(1L, 2L);
            })
            .verifyComplete();

        verify(metrics).recordTruncated();
    }

    @Test
    void testExecute_DelegatedTimeout_ReturnsInternalAndLeavesWorkerRunning() throws Exception {
        // Given: A delegated execution that blocks past a 1 second deadline
        QueryExecutor impatient = newExecutor(SETTINGS, Duration.ofSeconds(1), 10000);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        when(sqlExecutor.execute(any(), any())).thenAnswer(invocation -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
            finished.countDown();
            return new ExecutionResult(List.of("late"), List.of());
        });

        // When/Then: The caller gets a timeout error
        StepVerifier.create(impatient.execute(QueryRequest.of("SELECT * FROM slow", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.INTERNAL);
                assertThat(response.getError()).isEqualTo("query execution timeout after 1 seconds");
            })
            .verifyComplete();
        verify(metrics).recordQueryTimedOut();

        // And: The worker was not interrupted and completes on its own
        release.countDown();
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted.get()).isFalse();
    }

    @Test
    void testExecute_DelegatedParseError_KeepsStatus() {
        when(sqlExecutor.execute(any(), any()))
            .thenThrow(new QueryParseException("unsupported condition: a LIKE 'x'"));

        StepVerifier.create(queryExecutor.execute(QueryRequest.of("SELECT * FROM c WHERE a LIKE 'x'", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.BAD_REQUEST);
                assertThat(response.getError()).isEqualTo("unsupported condition: a LIKE 'x'");
            })
            .verifyComplete();
    }

    @Test
    void testExecute_UnexpectedFault_IsContained() {
        when(sqlExecutor.execute(any(), any())).thenThrow(new IllegalStateException("boom"));

        StepVerifier.create(queryExecutor.execute(QueryRequest.of("SELECT * FROM c", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.INTERNAL);
                assertThat(response.getError()).isEqualTo("internal server error");
            })
            .verifyComplete();

        verify(metrics).recordQueryFailed();
    }

    // ========== Settings and Edge Cases ==========

    @Test
    void testExecute_MissingProjectId_ReturnsConfigError() {
        QueryExecutor unconfigured = newExecutor(new DatasourceSettings("", null), Duration.ofSeconds(30), 10000);

        StepVerifier.create(unconfigured.execute(
                QueryRequest.of("SELECT k, COUNT(*) FROM c GROUP BY k", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.BAD_REQUEST);
                assertThat(response.getError()).isEqualTo("ProjectID is required");
            })
            .verifyComplete();

        verifyNoInteractions(storeFactory, sqlExecutor);
    }

    @Test
    void testExecute_InvalidServiceAccount_ReturnsConfigError() {
        QueryExecutor misconfigured = newExecutor(
            new DatasourceSettings("demo-project", "{not json"), Duration.ofSeconds(30), 10000);

        StepVerifier.create(misconfigured.execute(QueryRequest.of("SELECT * FROM c", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(ErrorStatus.BAD_REQUEST);
                assertThat(response.getError()).isEqualTo("invalid service account, it is expected to be a JSON");
            })
            .verifyComplete();

        verifyNoInteractions(sqlExecutor);
    }

    @Test
    void testExecute_EmptyQuery_ReturnsEmptyResponse() {
        StepVerifier.create(queryExecutor.execute(QueryRequest.of("  ", TimeWindow.NONE)))
            .assertNext(response -> {
                assertThat(response.getFrames()).isEmpty();
                assertThat(response.hasError()).isFalse();
            })
            .verifyComplete();

        verifyNoInteractions(storeFactory, sqlExecutor, metrics);
    }

    @Test
    void testExecuteAll_AnswersEachQueryByRefId() {
        when(sqlExecutor.execute(any(), eq("SELECT * FROM c")))
            .thenReturn(new ExecutionResult(List.of("a"), List.of(List.of("x"))));

        List<QueryRequest> requests = List.of(
            new QueryRequest("B", "SELECT * FROM c", null, TimeWindow.NONE),
            new QueryRequest("A", "", null, TimeWindow.NONE));

        StepVerifier.create(queryExecutor.executeAll(requests))
            .assertNext(responses -> {
                assertThat(responses).containsOnlyKeys("B", "A");
                assertThat(responses.keySet()).containsExactly("B", "A");
                assertThat(responses.get("B").getFrames()).hasSize(1);
                assertThat(responses.get("A").getFrames()).isEmpty();
            })
            .verifyComplete();
    }

    @Test
    void testRetrievalLimit_CapsNonAggregatingLimit() {
        QueryParser parser = new QueryParser(QueryDiagnostics.NOOP);

        assertThat(queryExecutor.retrievalLimit(parser.parse("SELECT * FROM c LIMIT 20"))).isEqualTo(20);
        assertThat(queryExecutor.retrievalLimit(parser.parse("SELECT * FROM c LIMIT 50000"))).isEqualTo(10000);
        assertThat(queryExecutor.retrievalLimit(parser.parse("SELECT * FROM c"))).isEqualTo(10000);
        assertThat(queryExecutor.retrievalLimit(
            parser.parse("SELECT k, COUNT(*) FROM c GROUP BY k LIMIT 2"))).isEqualTo(10000);
    }
}

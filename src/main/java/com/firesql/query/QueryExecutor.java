package com.firesql.query;

import com.firesql.delegate.SqlExecutor;
import com.firesql.domain.DataResponse;
import com.firesql.domain.Document;
import com.firesql.domain.ErrorStatus;
import com.firesql.domain.ExecutionResult;
import com.firesql.domain.Frame;
import com.firesql.domain.TimeWindow;
import com.firesql.store.DatasourceSettings;
import com.firesql.store.DocumentStore;
import com.firesql.store.DocumentStoreFactory;
import com.firesql.store.StoreFilter;
import com.firesql.store.StoreOperator;
import com.firesql.store.StoreOrder;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * QueryExecutor runs one query end to end and always answers with a {@link DataResponse}.
 *
 * This service:
 * - Validates the datasource settings before anything else
 * - Routes the query to the native plan path or the delegated executor
 * - Native path: parse, retrieve with push-down, filter, then aggregate or materialize
 * - Delegated path: run on a dedicated worker pool raced against a deadline,
 *   truncate to the row cap, materialize typed columns
 *
 * Every failure is converted into an error response for that query only. Known
 * failures keep their message and status; anything else becomes an opaque
 * internal error.
 */
@Service
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    static final String INTERNAL_ERROR = "internal server error";

    private final QueryParser parser;
    private final QueryRouter router;
    private final DocumentFilter documentFilter;
    private final GroupAggregator aggregator;
    private final ResultMaterializer materializer;
    private final DocumentStoreFactory storeFactory;
    private final SqlExecutor sqlExecutor;
    private final DatasourceSettings settings;
    private final QueryMetrics metrics;
    private final Duration timeout;
    private final int maxDelegatedRows;
    private final int maxNativeDocuments;
    private final ExecutorService workers;

    public QueryExecutor(
            QueryParser parser,
            QueryRouter router,
            DocumentFilter documentFilter,
            GroupAggregator aggregator,
            ResultMaterializer materializer,
            DocumentStoreFactory storeFactory,
            SqlExecutor sqlExecutor,
            DatasourceSettings settings,
            QueryMetrics metrics,
            @Value("${firesql.query.timeout:30s}") Duration timeout,
            @Value("${firesql.query.delegated-max-rows:10000}") int maxDelegatedRows,
            @Value("${firesql.query.native-max-documents:10000}") int maxNativeDocuments) {
        this.parser = parser;
        this.router = router;
        this.documentFilter = documentFilter;
        this.aggregator = aggregator;
        this.materializer = materializer;
        this.storeFactory = storeFactory;
        this.sqlExecutor = sqlExecutor;
        this.settings = settings;
        this.metrics = metrics;
        this.timeout = timeout;
        this.maxDelegatedRows = maxDelegatedRows;
        this.maxNativeDocuments = maxNativeDocuments;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "firesql-delegated-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("QueryExecutor initialized (timeout={}s, maxDelegatedRows={}, maxNativeDocuments={})",
            timeout.getSeconds(), maxDelegatedRows, maxNativeDocuments);
    }

    /**
     * Execute every request independently, keyed by refId in request order.
     */
    public Mono<Map<String, DataResponse>> executeAll(List<QueryRequest> requests) {
        return Flux.fromIterable(requests)
            .flatMapSequential(request -> execute(request)
                .map(response -> Map.entry(request.getRefId(), response)))
            .collect(LinkedHashMap::new, (responses, entry) -> responses.put(entry.getKey(), entry.getValue()));
    }

    /**
     * Execute a single query.
     *
     * @param request the query with its time window
     * @return a Mono emitting exactly one response, never an error signal
     */
    public Mono<DataResponse> execute(QueryRequest request) {
        if (request == null || request.isEmpty()) {
            log.debug("Received empty query, returning empty response");
            return Mono.just(new DataResponse());
        }

        long startTime = System.currentTimeMillis();
        Timer.Sample sample = metrics.startTimer();
        metrics.recordQueryExecuted();

        return Mono.defer(() -> {
                settings.validate();
                ExecutionPath path = router.route(request.getQuery(), request.getWindow());
                metrics.recordRoute(path);
                log.debug("Query {} routed to {} path", request.getRefId(), path);
                return path == ExecutionPath.NATIVE
                    ? Mono.fromCallable(() -> executeNative(request)).subscribeOn(Schedulers.boundedElastic())
                    : executeDelegated(request);
            })
            .doOnNext(response -> metrics.recordResultRows(rowCount(response)))
            .onErrorResume(QueryExecutionException.class, error -> {
                log.warn("Query {} failed: {}", request.getRefId(), error.getMessage());
                metrics.recordQueryFailed();
                return Mono.just(DataResponse.error(error.getStatus(), error.getMessage()));
            })
            .onErrorResume(error -> {
                log.error("Unexpected error executing query {}", request.getRefId(), error);
                metrics.recordQueryFailed();
                return Mono.just(DataResponse.error(ErrorStatus.INTERNAL, INTERNAL_ERROR));
            })
            .doOnNext(response -> response.setExecutionTimeMs(System.currentTimeMillis() - startTime))
            .doFinally(signal -> metrics.recordQueryLatency(sample));
    }

    DataResponse executeNative(QueryRequest request) {
        Timer.Sample sample = metrics.startTimer();
        try {
            QueryPlan plan = parser.parse(request.getQuery());
            log.debug("Native plan for query {}: {}", request.getRefId(), plan);

            DocumentStore store = storeFactory.connect(settings);
            List<Document> documents = store.query(
                plan.getCollection(),
                pushDownFilters(plan, request.getWindow()),
                pushDownOrder(plan),
                retrievalLimit(plan));
            metrics.recordDocumentsRetrieved(documents.size());
            log.debug("Retrieved {} documents from {}", documents.size(), plan.getCollection());

            List<Document> filtered = documentFilter.apply(documents, plan.getAdditionalFilters());

            Frame frame;
            if (plan.isAggregating()) {
                frame = materializer.fromAggregates(aggregator.aggregate(filtered, plan), plan);
            } else {
                frame = materializer.fromDocuments(filtered, plan, timeField(plan, request));
            }
            return DataResponse.of(frame);
        } finally {
            metrics.recordNativeLatency(sample);
        }
    }

    /**
     * The plan's time field, else the one named on the request.
     */
    static String timeField(QueryPlan plan, QueryRequest request) {
        return plan.hasTimeField() ? plan.getTimeField() : request.getTimeField();
    }

    /**
     * Time bounds only; equality filters are always evaluated in memory.
     */
    static List<StoreFilter> pushDownFilters(QueryPlan plan, TimeWindow window) {
        List<StoreFilter> filters = new ArrayList<>();
        if (plan.hasTimeField() && window.hasBounds()) {
            filters.add(new StoreFilter(plan.getTimeField(), StoreOperator.GTE, window.getFrom()));
            filters.add(new StoreFilter(plan.getTimeField(), StoreOperator.LTE, window.getTo()));
        }
        return filters;
    }

    /**
     * Ordering of an aggregating plan applies to the aggregated rows, so it is not pushed down.
     */
    static StoreOrder pushDownOrder(QueryPlan plan) {
        if (plan.isAggregating() || !plan.hasOrderField()) {
            return null;
        }
        return new StoreOrder(plan.getOrderField(), plan.getOrderDirection());
    }

    int retrievalLimit(QueryPlan plan) {
        if (!plan.isAggregating() && plan.getLimit() > 0) {
            return Math.min(plan.getLimit(), maxNativeDocuments);
        }
        return maxNativeDocuments;
    }

    Mono<DataResponse> executeDelegated(QueryRequest request) {
        Timer.Sample sample = metrics.startTimer();
        String query = request.getQuery();

        // Cancelling the future on timeout does not interrupt the worker; its late result is dropped.
        return Mono.fromFuture(() -> CompletableFuture.supplyAsync(() -> sqlExecutor.execute(settings, query), workers))
            .timeout(timeout)
            .onErrorMap(CompletionException.class, error -> error.getCause() != null ? error.getCause() : error)
            .onErrorMap(TimeoutException.class, error -> {
                log.warn("Delegated query {} timed out after {}s", request.getRefId(), timeout.getSeconds());
                metrics.recordQueryTimedOut();
                return new QueryTimeoutException(timeout, error);
            })
            .defaultIfEmpty(new ExecutionResult(null, null))
            .map(result -> {
                if (result.getRecords().size() > maxDelegatedRows) {
                    log.warn("Delegated query {} returned {} rows, truncating to {}",
                        request.getRefId(), result.getRecords().size(), maxDelegatedRows);
                    metrics.recordTruncated();
                    result = result.truncate(maxDelegatedRows);
                }
                return DataResponse.of(materializer.fromRecords(result));
            })
            .doFinally(signal -> metrics.recordDelegatedLatency(sample));
    }

    private static int rowCount(DataResponse response) {
        return response.getFrames().stream().mapToInt(Frame::getRowCount).max().orElse(0);
    }

    /**
     * Stop accepting delegated work on shutdown. Running workers are left to finish.
     */
    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}

package com.firesql.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query execution.
 * Tracks outcomes, routing decisions, latency per path and result sizes.
 */
@Component
public class QueryMetrics {

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter queriesTimedOut;
    private Counter nativeQueries;
    private Counter delegatedQueries;
    private Counter truncatedResults;
    private Timer queryExecutionLatency;
    private Timer nativeLatency;
    private Timer delegatedLatency;
    private DistributionSummary documentsRetrieved;
    private DistributionSummary resultRows;

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("firesql.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("firesql.query.failed")
            .description("Total number of queries answered with an error")
            .register(meterRegistry);

        queriesTimedOut = Counter.builder("firesql.query.timedout")
            .description("Total number of delegated queries that timed out")
            .register(meterRegistry);

        nativeQueries = Counter.builder("firesql.query.route.native")
            .description("Queries routed to the native plan path")
            .register(meterRegistry);

        delegatedQueries = Counter.builder("firesql.query.route.delegated")
            .description("Queries routed to the delegated executor")
            .register(meterRegistry);

        truncatedResults = Counter.builder("firesql.query.truncated")
            .description("Delegated results cut at the row cap")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("firesql.query.execution.latency")
            .description("Latency of overall query execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        nativeLatency = Timer.builder("firesql.query.native.latency")
            .description("Latency of native plan execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        delegatedLatency = Timer.builder("firesql.query.delegated.latency")
            .description("Latency of delegated execution")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        documentsRetrieved = DistributionSummary.builder("firesql.query.documents.retrieved")
            .description("Documents retrieved from the store per native query")
            .baseUnit("documents")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        resultRows = DistributionSummary.builder("firesql.query.result.rows")
            .description("Rows in the returned frame")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(1.0)
            .maximumExpectedValue(10000.0)
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordQueryTimedOut() {
        queriesTimedOut.increment();
    }

    public void recordRoute(ExecutionPath path) {
        if (path == ExecutionPath.NATIVE) {
            nativeQueries.increment();
        } else {
            delegatedQueries.increment();
        }
    }

    public void recordTruncated() {
        truncatedResults.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordNativeLatency(Timer.Sample sample) {
        sample.stop(nativeLatency);
    }

    public void recordDelegatedLatency(Timer.Sample sample) {
        sample.stop(delegatedLatency);
    }

    public void recordDocumentsRetrieved(long count) {
        documentsRetrieved.record(count);
    }

    public void recordResultRows(long rows) {
        resultRows.record(rows);
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesTimedOut() {
        return queriesTimedOut;
    }

    public Counter getNativeQueries() {
        return nativeQueries;
    }

    public Counter getDelegatedQueries() {
        return delegatedQueries;
    }

    public Counter getTruncatedResults() {
        return truncatedResults;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public Timer getNativeLatency() {
        return nativeLatency;
    }

    public Timer getDelegatedLatency() {
        return delegatedLatency;
    }

    public DistributionSummary getDocumentsRetrieved() {
        return documentsRetrieved;
    }

    public DistributionSummary getResultRows() {
        return resultRows;
    }
}

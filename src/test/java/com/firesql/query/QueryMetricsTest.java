package com.firesql.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Test suite for QueryMetrics
 */
@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {

    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics();
        ReflectionTestUtils.setField(queryMetrics, "meterRegistry", meterRegistry);
        queryMetrics.init();
    }

    @Test
    @DisplayName("Should initialize all metrics on startup")
    void shouldInitializeAllMetrics() {
        assertThat(queryMetrics.getQueriesExecuted()).isNotNull();
        assertThat(queryMetrics.getQueriesFailed()).isNotNull();
        assertThat(queryMetrics.getQueriesTimedOut()).isNotNull();
        assertThat(queryMetrics.getNativeQueries()).isNotNull();
        assertThat(queryMetrics.getDelegatedQueries()).isNotNull();
        assertThat(queryMetrics.getTruncatedResults()).isNotNull();
        assertThat(queryMetrics.getQueryExecutionLatency()).isNotNull();
        assertThat(queryMetrics.getNativeLatency()).isNotNull();
        assertThat(queryMetrics.getDelegatedLatency()).isNotNull();
        assertThat(queryMetrics.getDocumentsRetrieved()).isNotNull();
        assertThat(queryMetrics.getResultRows()).isNotNull();
    }

    @Test
    @DisplayName("Should count outcomes")
    void shouldCountOutcomes() {
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryFailed();
        queryMetrics.recordQueryTimedOut();
        queryMetrics.recordTruncated();

        assertThat(queryMetrics.getQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getQueriesFailed().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getQueriesTimedOut().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getTruncatedResults().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count routes per path")
    void shouldCountRoutes() {
        queryMetrics.recordRoute(ExecutionPath.NATIVE);
        queryMetrics.recordRoute(ExecutionPath.DELEGATED);
        queryMetrics.recordRoute(ExecutionPath.DELEGATED);

        assertThat(queryMetrics.getNativeQueries().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getDelegatedQueries().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("firesql.query.route.delegated").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should record latency samples per timer")
    void shouldRecordLatency() {
        Timer.Sample overall = queryMetrics.startTimer();
        Timer.Sample nativePath = queryMetrics.startTimer();
        Timer.Sample delegated = queryMetrics.startTimer();

        queryMetrics.recordQueryLatency(overall);
        queryMetrics.recordNativeLatency(nativePath);
        queryMetrics.recordDelegatedLatency(delegated);

        assertThat(queryMetrics.getQueryExecutionLatency().count()).isEqualTo(1);
        assertThat(queryMetrics.getNativeLatency().count()).isEqualTo(1);
        assertThat(queryMetrics.getDelegatedLatency().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should track result size distributions")
    void shouldTrackSizes() {
        queryMetrics.recordDocumentsRetrieved(100);
        queryMetrics.recordDocumentsRetrieved(300);
        queryMetrics.recordResultRows(5);

        assertThat(queryMetrics.getDocumentsRetrieved().count()).isEqualTo(2);
        assertThat(queryMetrics.getDocumentsRetrieved().totalAmount()).isEqualTo(400.0);
        assertThat(queryMetrics.getDocumentsRetrieved().max()).isEqualTo(300.0);
        assertThat(queryMetrics.getResultRows().totalAmount()).isEqualTo(5.0);
    }
}

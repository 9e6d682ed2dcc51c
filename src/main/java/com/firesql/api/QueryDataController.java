package com.firesql.api;

import com.firesql.domain.TimeWindow;
import com.firesql.query.QueryExecutor;
import com.firesql.query.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Query-data endpoint used by the dashboard.
 * Each query in the request is answered independently; one failing query
 * does not affect the others.
 */
@RestController
@RequestMapping("/api/datasource")
public class QueryDataController {
    private static final Logger log = LoggerFactory.getLogger(QueryDataController.class);

    private final QueryExecutor queryExecutor;

    public QueryDataController(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /**
     * POST /api/datasource/query
     * @param request time range and queries
     * @return responses keyed by refId
     */
    @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryDataResponse> query(@RequestBody QueryDataRequest request) {
        TimeWindow window = request.getRange() != null ? request.getRange().toWindow() : TimeWindow.NONE;
        List<QueryRequest> requests = new ArrayList<>();
        if (request.getQueries() != null) {
            for (DataQuery query : request.getQueries()) {
                requests.add(new QueryRequest(query.getRefId(), query.getQuery(), query.getTimeField(), window));
            }
        }
        log.debug("Received query-data request with {} queries, window {}", requests.size(), window);

        return queryExecutor.executeAll(requests).map(QueryDataResponse::new);
    }
}

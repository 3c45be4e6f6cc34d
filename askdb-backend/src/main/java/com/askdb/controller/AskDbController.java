package com.askdb.controller;

import com.askdb.api.ConnectionTestRequest;
import com.askdb.api.ErrorResponse;
import com.askdb.api.PoolStatusResponse;
import com.askdb.api.QueryRequest;
import com.askdb.api.QueryResponse;
import com.askdb.api.SchemaRequest;
import com.askdb.api.SchemaResponse;
import com.askdb.api.StreamEvent;
import com.askdb.notify.TenantActivityTracker;
import com.askdb.pool.ConnectionPoolManager;
import com.askdb.pool.PoolStats;
import com.askdb.query.QueryAnswer;
import com.askdb.query.QueryPipeline;
import com.askdb.query.StreamEventSink;
import com.askdb.schema.SchemaIntrospector;
import com.askdb.schema.SchemaMap;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/v1")
public class AskDbController {

    private static final Logger log = LoggerFactory.getLogger(AskDbController.class);

    private static final String TRACE_ID = "trace_id";
    // the pipeline bounds each phase itself
    private static final long SSE_TIMEOUT_MS = 0L;

    private final QueryPipeline queryPipeline;
    private final SchemaIntrospector schemaIntrospector;
    private final ConnectionPoolManager connectionPoolManager;
    private final TenantActivityTracker tenantActivityTracker;
    private final ExecutorService streamExecutor;

    public AskDbController(
            QueryPipeline queryPipeline,
            SchemaIntrospector schemaIntrospector,
            ConnectionPoolManager connectionPoolManager,
            TenantActivityTracker tenantActivityTracker,
            @Qualifier("askdbStreamExecutor") ExecutorService streamExecutor
    ) {
        this.queryPipeline = queryPipeline;
        this.schemaIntrospector = schemaIntrospector;
        this.connectionPoolManager = connectionPoolManager;
        this.tenantActivityTracker = tenantActivityTracker;
        this.streamExecutor = streamExecutor;
    }

    /**
     * Answer a question and return the rows.
     *
     * POST /v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        log.info("Query requested: tenant_id={}, trace_id={}", request.getTenantId(), MDC.get(TRACE_ID));
        QueryAnswer answer = queryPipeline.ask(
                request.getTenantId(), request.getDsn(), request.getQuestion(), request.getDbType());
        return ResponseEntity.ok(QueryResponse.builder()
                .sql(answer.sql())
                .explanation(answer.explanation())
                .rows(answer.rows())
                .rowCount(answer.rowCount())
                .elapsedMillis(answer.elapsedMillis())
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * Answer a question as server-sent events, one JSON {@link StreamEvent} per message.
     *
     * POST /v1/query/stream
     */
    @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter queryStream(@Valid @RequestBody QueryRequest request) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        SseEventSink sink = new SseEventSink(emitter);
        emitter.onCompletion(sink::markClosed);
        emitter.onTimeout(sink::markClosed);
        emitter.onError(e -> sink.markClosed());

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        log.info("Streaming query requested: tenant_id={}, trace_id={}", request.getTenantId(), MDC.get(TRACE_ID));
        try {
            streamExecutor.execute(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    queryPipeline.askStreaming(request.getTenantId(), request.getDsn(),
                            request.getQuestion(), request.getDbType(), sink);
                } finally {
                    sink.complete();
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Rejected streaming query for tenant {}: server is shutting down", request.getTenantId());
            sink.send(StreamEvent.error("Server is shutting down"));
            sink.complete();
        }
        return emitter;
    }

    /**
     * Return the tenant's public schema.
     *
     * POST /v1/schema
     */
    @PostMapping("/schema")
    public ResponseEntity<SchemaResponse> schema(@Valid @RequestBody SchemaRequest request) {
        SchemaMap schema = schemaIntrospector.fetchSchema(request.getTenantId(), request.getDsn());
        return ResponseEntity.ok(SchemaResponse.builder()
                .tenantId(request.getTenantId())
                .tableCount(schema.tableCount())
                .tables(schema.tables())
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    /**
     * Check that a DSN is reachable and the credentials work.
     *
     * POST /v1/connections/test
     */
    @PostMapping("/connections/test")
    public ResponseEntity<Map<String, Object>> testConnection(@Valid @RequestBody ConnectionTestRequest request) {
        connectionPoolManager.testConnection(request.getDsn());
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @DeleteMapping("/tenants/{tenantId}/pool")
    public ResponseEntity<Map<String, Object>> closePool(@PathVariable("tenantId") String tenantId) {
        log.info("Pool close requested: tenant_id={}, trace_id={}", tenantId, MDC.get(TRACE_ID));
        boolean closed = connectionPoolManager.closePool(tenantId);
        return ResponseEntity.ok(Map.of("closed", closed));
    }

    @GetMapping("/tenants/{tenantId}/pool")
    public ResponseEntity<?> poolStatus(@PathVariable("tenantId") String tenantId) {
        Optional<PoolStats> stats = connectionPoolManager.stats(tenantId);
        if (stats.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of("POOL_NOT_FOUND", "No connection pool for tenant: " + tenantId, null));
        }
        PoolStats s = stats.get();
        return ResponseEntity.ok(PoolStatusResponse.builder()
                .tenantId(s.tenantId())
                .totalConnections(s.totalConnections())
                .activeConnections(s.activeConnections())
                .idleConnections(s.idleConnections())
                .threadsAwaitingConnection(s.threadsAwaitingConnection())
                .lastUsedAt(tenantActivityTracker.lastUsedAt(tenantId).orElse(null))
                .build());
    }

    /**
     * Adapts an {@link SseEmitter} to the pipeline's sink. A failed send means the client is
     * gone, so the sink closes instead of throwing.
     */
    static final class SseEventSink implements StreamEventSink {
        private final SseEmitter emitter;
        private final AtomicBoolean open = new AtomicBoolean(true);

        SseEventSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void send(StreamEvent event) {
            if (!open.get()) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE client went away: {}", e.getMessage());
                markClosed();
            }
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        void markClosed() {
            open.set(false);
        }

        void complete() {
            if (open.getAndSet(false)) {
                emitter.complete();
            }
        }
    }
}

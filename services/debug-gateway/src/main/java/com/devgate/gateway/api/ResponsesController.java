package com.devgate.gateway.api;

import com.devgate.eventmodel.AggregateResponse;
import com.devgate.eventmodel.EventSequence;
import com.devgate.gateway.domain.EntityCatalog;
import com.devgate.gateway.domain.EntityInfo;
import com.devgate.gateway.domain.ExecutionEngine;
import com.devgate.gateway.domain.ExecutionRequest;
import com.devgate.gateway.streaming.SseStreamAggregator;
import com.devgate.observability.CorrelationContextHolder;
import com.devgate.observability.SpanHelper;
import com.devgate.security.context.ExecutionContext;
import com.devgate.security.context.ExecutionContextPropagator;
import jakarta.servlet.http.HttpServletResponse;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * OpenAI-style responses endpoint: runs an entity synchronously or streams its events.
 *
 * <p>The streaming body is written on the MVC async executor. The caller's execution context and
 * correlation id are captured on the request thread and re-bound there, so code running inside
 * the engine sees the same caller as the request.
 */
@RestController
public class ResponsesController {

    private static final Logger log = LoggerFactory.getLogger(ResponsesController.class);

    static final String ATTR_ENTITY_ID = "devgate.entity.id";
    static final String ATTR_STREAM_OUTCOME = "devgate.stream.outcome";

    private final EntityCatalog catalog;
    private final ExecutionEngine engine;
    private final SseStreamAggregator aggregator;
    private final ExecutionContextPropagator propagator;
    private final SpanHelper spans;

    public ResponsesController(
            EntityCatalog catalog,
            ExecutionEngine engine,
            SseStreamAggregator aggregator,
            ExecutionContextPropagator propagator,
            SpanHelper spans) {
        this.catalog = catalog;
        this.engine = engine;
        this.aggregator = aggregator;
        this.propagator = propagator;
        this.spans = spans;
    }

    /**
     * Returns a {@link ResponseEntity} for JSON answers and a bare {@link StreamingResponseBody}
     * when streaming: MVC starts async streaming only for a return value that is itself a
     * {@code StreamingResponseBody}, or a {@code ResponseEntity} declared with that body type.
     */
    @PostMapping("/v1/responses")
    public Object createResponse(@RequestBody ResponseRequest request, HttpServletResponse response) {
        String entityId = request.entityId();
        if (entityId == null) {
            return OpenAiError.response(HttpStatus.BAD_REQUEST, OpenAiError.INVALID_REQUEST, "missing_entity_id",
                    "Missing entity_id. Set extra_body.entity_id or model.");
        }
        Optional<EntityInfo> entity = catalog.get(entityId);
        if (entity.isEmpty()) {
            return OpenAiError.response(HttpStatus.NOT_FOUND, OpenAiError.INVALID_REQUEST, "entity_not_found",
                    "Entity not found: " + entityId);
        }
        log.info("Executing {} '{}' (stream={})", entity.get().type(), entityId, request.streaming());

        ExecutionRequest execution = new ExecutionRequest(
                entityId, request.inputText(), request.conversation(), metadataFor(request));
        if (request.streaming()) {
            response.setContentType(MediaType.TEXT_EVENT_STREAM_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
            response.setHeader("X-Accel-Buffering", "no");
            return streamingBody(execution);
        }
        return executeNow(execution);
    }

    private ResponseEntity<Object> executeNow(ExecutionRequest execution) {
        String entityId = execution.entityId();
        try {
            AggregateResponse response = spans.withSpan("execute " + entityId,
                    Map.of(ATTR_ENTITY_ID, entityId), () -> engine.execute(execution));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Error executing request for '{}'", entityId, e);
            return OpenAiError.response(HttpStatus.INTERNAL_SERVER_ERROR, OpenAiError.SERVER_ERROR, "execution_failed",
                    "Execution failed: " + e.getMessage());
        }
    }

    private StreamingResponseBody streamingBody(ExecutionRequest execution) {
        String entityId = execution.entityId();
        String responseId = EventSequence.newResponseId();
        AtomicReference<OutputStream> sink = new AtomicReference<>();
        Runnable stream = spans.traced("stream " + entityId, Map.of(ATTR_ENTITY_ID, entityId), () -> {
            // opened by the aggregator so a failure to start is reported as an error frame
            SseStreamAggregator.Outcome outcome = aggregator.stream(
                    () -> engine.executeStreaming(execution), sink.get(), responseId, entityId);
            SpanHelper.annotateCurrent(ATTR_STREAM_OUTCOME, outcome.name());
        });
        // captured here, on the request thread, where both contexts are bound
        Runnable bound = CorrelationContextHolder.wrap(propagator.wrap(stream));
        return out -> {
            sink.set(out);
            bound.run();
        };
    }

    private Map<String, Object> metadataFor(ResponseRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) {
            metadata.putAll(request.metadata());
        }
        propagator.currentContext().map(ExecutionContext::toMetadata).ifPresent(metadata::putAll);
        return metadata;
    }
}

package com.devgate.gateway.domain;

import com.devgate.eventmodel.AggregateResponse;
import com.devgate.eventmodel.ExecutionEvent;
import com.devgate.eventmodel.ResponseAggregator;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs entities and reports what they do as an ordered event stream.
 */
public interface ExecutionEngine {

    /**
     * Starts executing and returns the events lazily, in emission order. A failure while
     * producing events is thrown from the stream's terminal operation.
     */
    Stream<ExecutionEvent> executeStreaming(ExecutionRequest request);

    /**
     * Runs to completion and returns the folded result.
     */
    default AggregateResponse execute(ExecutionRequest request) {
        List<ExecutionEvent> events;
        try (Stream<ExecutionEvent> stream = executeStreaming(request)) {
            events = stream.toList();
        }
        return ResponseAggregator.aggregate(events, null, request.entityId(), Instant.now());
    }
}

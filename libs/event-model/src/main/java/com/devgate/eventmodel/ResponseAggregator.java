package com.devgate.eventmodel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the events of one execution into a single {@link AggregateResponse}.
 */
public final class ResponseAggregator {

    private ResponseAggregator() {
        // utility class
    }

    /**
     * Builds the aggregate. The response id comes from a {@code response.created} event when
     * present, else from {@code fallbackResponseId}.
     */
    public static AggregateResponse aggregate(List<? extends ExecutionEvent> events, String fallbackResponseId,
                                              String model, Instant createdAt) {
        String responseId = fallbackResponseId;
        String resolvedModel = model;
        StringBuilder text = new StringBuilder();
        Map<String, AggregateResponse.ToolCall> toolCalls = new LinkedHashMap<>();
        String error = null;

        for (ExecutionEvent event : events) {
            if (event instanceof ExecutionEvent.ResponseCreated created) {
                responseId = created.responseId();
                if (created.model() != null) {
                    resolvedModel = created.model();
                }
            } else if (event instanceof ExecutionEvent.OutputTextDelta delta) {
                text.append(delta.delta());
            } else if (event instanceof ExecutionEvent.FunctionCall call) {
                toolCalls.put(call.callId(),
                        new AggregateResponse.ToolCall(call.callId(), call.name(), call.arguments(), null, null));
            } else if (event instanceof ExecutionEvent.FunctionResult result) {
                AggregateResponse.ToolCall call = toolCalls.get(result.callId());
                toolCalls.put(result.callId(), call == null
                        ? new AggregateResponse.ToolCall(result.callId(), null, null, result.output(), result.status())
                        : call.withResult(result.output(), result.status()));
            } else if (event instanceof ExecutionEvent.ExecutionError failure) {
                error = failure.message();
            }
        }

        return new AggregateResponse(
                responseId == null ? EventSequence.newResponseId() : responseId,
                AggregateResponse.OBJECT,
                createdAt.getEpochSecond(),
                resolvedModel,
                error == null ? AggregateResponse.STATUS_COMPLETED : AggregateResponse.STATUS_FAILED,
                text.toString(),
                new ArrayList<>(toolCalls.values()),
                error);
    }

    /**
     * The closing event for a stream: the aggregate, numbered after every prior event.
     */
    public static ExecutionEvent.ResponseCompleted complete(List<? extends ExecutionEvent> events,
                                                            String fallbackResponseId, String model, Instant createdAt) {
        return new ExecutionEvent.ResponseCompleted(
                aggregate(events, fallbackResponseId, model, createdAt), events.size());
    }
}

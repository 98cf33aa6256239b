package com.devgate.eventmodel;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the events of one response, numbering them in creation order.
 * <p>
 * WHY a factory: producers never pick sequence numbers or item ids themselves, so a response
 * always has a gap-free numbering starting at zero.
 */
public final class EventSequence {

    private final String responseId;
    private final String model;
    private final AtomicInteger next = new AtomicInteger();

    public EventSequence(String responseId, String model) {
        if (responseId == null || responseId.isBlank()) {
            throw new IllegalArgumentException("responseId must not be null or blank");
        }
        this.responseId = responseId;
        this.model = model;
    }

    /**
     * Starts a sequence with a generated response id.
     */
    public static EventSequence start(String model) {
        return new EventSequence(newResponseId(), model);
    }

    public static String newResponseId() {
        return "resp_" + UUID.randomUUID().toString().replace("-", "");
    }

    public static String newItemId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public String responseId() {
        return responseId;
    }

    public String model() {
        return model;
    }

    /** Number of events created so far. */
    public int count() {
        return next.get();
    }

    public ExecutionEvent.ResponseCreated created() {
        return new ExecutionEvent.ResponseCreated(responseId, model, next.getAndIncrement());
    }

    public ExecutionEvent.ResponseInProgress inProgress() {
        return new ExecutionEvent.ResponseInProgress(responseId, next.getAndIncrement());
    }

    public ExecutionEvent.OutputTextDelta textDelta(String itemId, String delta) {
        return new ExecutionEvent.OutputTextDelta(itemId, 0, delta, next.getAndIncrement());
    }

    public ExecutionEvent.FunctionCall functionCall(String callId, String name, String argumentsJson) {
        return new ExecutionEvent.FunctionCall(newItemId("fc"), callId, name, argumentsJson, next.getAndIncrement());
    }

    public ExecutionEvent.FunctionResult functionResult(String callId, String output, boolean succeeded) {
        return new ExecutionEvent.FunctionResult(callId, output, succeeded ? "completed" : "failed",
                next.getAndIncrement());
    }

    public ExecutionEvent.ExecutionError error(String message, String code) {
        return new ExecutionEvent.ExecutionError(message, code, next.getAndIncrement());
    }
}

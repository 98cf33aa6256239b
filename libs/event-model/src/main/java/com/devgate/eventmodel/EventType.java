package com.devgate.eventmodel;

import java.util.Arrays;
import java.util.Optional;

/**
 * Wire names of the events emitted while an entity executes.
 */
public enum EventType {

    RESPONSE_CREATED("response.created"),
    RESPONSE_IN_PROGRESS("response.in_progress"),
    OUTPUT_TEXT_DELTA("response.output_text.delta"),
    FUNCTION_CALL("response.function_call.complete"),
    FUNCTION_RESULT("response.function_result.complete"),
    ERROR("error"),
    RESPONSE_COMPLETED("response.completed");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The {@code type} field as written on the wire. */
    public String value() {
        return value;
    }

    /** True for the event that closes a response. */
    public boolean isTerminal() {
        return this == RESPONSE_COMPLETED;
    }

    public static Optional<EventType> fromValue(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}

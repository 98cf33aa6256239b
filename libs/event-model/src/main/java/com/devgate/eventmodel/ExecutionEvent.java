package com.devgate.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One event produced while an entity executes, in emission order.
 * <p>
 * Serialized with a {@code type} discriminator carrying the {@link EventType} wire name and a
 * {@code sequence_number} giving the event's position in its response.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExecutionEvent.ResponseCreated.class, name = "response.created"),
        @JsonSubTypes.Type(value = ExecutionEvent.ResponseInProgress.class, name = "response.in_progress"),
        @JsonSubTypes.Type(value = ExecutionEvent.OutputTextDelta.class, name = "response.output_text.delta"),
        @JsonSubTypes.Type(value = ExecutionEvent.FunctionCall.class, name = "response.function_call.complete"),
        @JsonSubTypes.Type(value = ExecutionEvent.FunctionResult.class, name = "response.function_result.complete"),
        @JsonSubTypes.Type(value = ExecutionEvent.ExecutionError.class, name = "error"),
        @JsonSubTypes.Type(value = ExecutionEvent.ResponseCompleted.class, name = "response.completed")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface ExecutionEvent {

    EventType type();

    int sequenceNumber();

    record ResponseCreated(
            @JsonProperty("response_id") String responseId,
            @JsonProperty("model") String model,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        @Override
        public EventType type() {
            return EventType.RESPONSE_CREATED;
        }
    }

    record ResponseInProgress(
            @JsonProperty("response_id") String responseId,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        @Override
        public EventType type() {
            return EventType.RESPONSE_IN_PROGRESS;
        }
    }

    /** A chunk of assistant text. */
    record OutputTextDelta(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("output_index") int outputIndex,
            @JsonProperty("delta") String delta,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        public OutputTextDelta {
            if (delta == null) {
                throw new IllegalArgumentException("delta must not be null");
            }
        }

        @Override
        public EventType type() {
            return EventType.OUTPUT_TEXT_DELTA;
        }
    }

    /** The entity invoked a tool. {@code arguments} is a JSON document. */
    record FunctionCall(
            @JsonProperty("item_id") String itemId,
            @JsonProperty("call_id") String callId,
            @JsonProperty("name") String name,
            @JsonProperty("arguments") String arguments,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        public FunctionCall {
            if (callId == null || callId.isBlank()) {
                throw new IllegalArgumentException("callId must not be null or blank");
            }
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
        }

        @Override
        public EventType type() {
            return EventType.FUNCTION_CALL;
        }
    }

    /** A tool returned. {@code status} is {@code completed} or {@code failed}. */
    record FunctionResult(
            @JsonProperty("call_id") String callId,
            @JsonProperty("output") String output,
            @JsonProperty("status") String status,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        public FunctionResult {
            if (callId == null || callId.isBlank()) {
                throw new IllegalArgumentException("callId must not be null or blank");
            }
        }

        @Override
        public EventType type() {
            return EventType.FUNCTION_RESULT;
        }
    }

    /** An error the entity reported as part of its output; the stream itself continues. */
    record ExecutionError(
            @JsonProperty("message") String message,
            @JsonProperty("code") String code,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        @Override
        public EventType type() {
            return EventType.ERROR;
        }
    }

    /** Closes a response, carrying the folded result of every prior event. */
    record ResponseCompleted(
            @JsonProperty("response") AggregateResponse response,
            @JsonProperty("sequence_number") int sequenceNumber
    ) implements ExecutionEvent {
        public ResponseCompleted {
            if (response == null) {
                throw new IllegalArgumentException("response must not be null");
            }
        }

        @Override
        public EventType type() {
            return EventType.RESPONSE_COMPLETED;
        }
    }
}

package com.devgate.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Wire format of the execution stream: JSON payloads carried in server-sent-events frames.
 * <p>
 * WHY single-line: an SSE frame ends at the first blank line, so a payload must never contain a
 * raw line break. Jackson already escapes line breaks inside strings; stripping the remaining
 * ones guards against pretty-printing serializers registered on the mapper.
 */
public final class EventSerializer {

    public static final String DATA_PREFIX = "data: ";
    public static final String FRAME_TERMINATOR = "\n\n";
    public static final String DONE_FRAME = DATA_PREFIX + "[DONE]" + FRAME_TERMINATOR;

    // metadata maps may carry Instants; they go out as ISO-8601 strings
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private EventSerializer() {
        // utility class
    }

    /**
     * Serializes any payload to JSON on one line.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String toSingleLineJson(Object payload) {
        String json;
        try {
            json = MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + describe(payload), e);
        }
        return json.indexOf('\n') < 0 && json.indexOf('\r') < 0
                ? json
                : json.replace("\r", "").replace("\n", "");
    }

    /** {@code data: <single-line json>\n\n}. */
    public static String frame(Object payload) {
        return DATA_PREFIX + toSingleLineJson(payload) + FRAME_TERMINATOR;
    }

    /**
     * The JSON carried by one frame, without the {@code data: } prefix and the terminator.
     *
     * @throws IllegalArgumentException if {@code frame} is not a data frame
     */
    public static String payloadOf(String frame) {
        if (frame == null || !frame.startsWith(DATA_PREFIX)) {
            throw new IllegalArgumentException("Not an SSE data frame: " + frame);
        }
        String payload = frame.substring(DATA_PREFIX.length());
        return payload.endsWith(FRAME_TERMINATOR)
                ? payload.substring(0, payload.length() - FRAME_TERMINATOR.length())
                : payload.strip();
    }

    /**
     * Reads an event written by {@link #toSingleLineJson(Object)}.
     *
     * @throws EventSerializationException if the JSON is malformed or the type is unknown
     */
    public static ExecutionEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, ExecutionEvent.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    private static String describe(Object payload) {
        if (payload instanceof ExecutionEvent event) {
            return "event " + event.type().value() + " #" + event.sequenceNumber();
        }
        return payload == null ? "null" : payload.getClass().getSimpleName();
    }

    /**
     * Thrown when an event cannot be written or read.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package com.devgate.gateway.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /v1/responses}.
 *
 * @param model        entity id when {@code extra_body.entity_id} is absent
 * @param input        a string, or a list of messages whose content is a string or a list of
 *                     parts carrying {@code text}
 * @param stream       whether to answer with server-sent events
 * @param conversation conversation id, if any
 * @param extraBody    vendor extensions; {@code entity_id} selects the entity
 * @param metadata     caller metadata passed through to the engine
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseRequest(
        @JsonProperty("model") String model,
        @JsonProperty("input") Object input,
        @JsonProperty("stream") Boolean stream,
        @JsonProperty("conversation") String conversation,
        @JsonProperty("extra_body") Map<String, Object> extraBody,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    static final String ENTITY_ID = "entity_id";

    /** The entity to run, or null when the request names none. */
    public String entityId() {
        if (extraBody != null && extraBody.get(ENTITY_ID) instanceof String id && !id.isBlank()) {
            return id;
        }
        return model == null || model.isBlank() ? null : model;
    }

    public boolean streaming() {
        return Boolean.TRUE.equals(stream);
    }

    /** The input flattened to text; message texts are joined with newlines. */
    public String inputText() {
        if (input == null) {
            return "";
        }
        if (input instanceof String text) {
            return text;
        }
        if (input instanceof List<?> messages) {
            StringBuilder text = new StringBuilder();
            for (Object message : messages) {
                appendText(text, message instanceof Map<?, ?> map ? map.get("content") : message);
            }
            return text.toString();
        }
        return input.toString();
    }

    private static void appendText(StringBuilder text, Object content) {
        if (content instanceof String value) {
            append(text, value);
        } else if (content instanceof List<?> parts) {
            for (Object part : parts) {
                if (part instanceof Map<?, ?> map && map.get("text") instanceof String value) {
                    append(text, value);
                }
            }
        }
    }

    private static void append(StringBuilder text, String value) {
        if (text.length() > 0) {
            text.append('\n');
        }
        text.append(value);
    }
}

package com.devgate.gateway.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A conversation thread.
 *
 * @param id        conversation id ({@code conv_...})
 * @param object    always {@code conversation}
 * @param createdAt epoch seconds
 * @param metadata  string attributes such as {@code agent_id}
 */
public record Conversation(
        @JsonProperty("id") String id,
        @JsonProperty("object") String object,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("metadata") Map<String, String> metadata) {

    public Conversation {
        object = "conversation";
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    Conversation withMetadata(Map<String, String> replacement) {
        return new Conversation(id, object, createdAt, replacement);
    }
}

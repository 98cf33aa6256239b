package com.devgate.gateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * One message in a conversation.
 *
 * @param id        item id ({@code item_...})
 * @param type      item type, normally {@code message}
 * @param role      {@code user}, {@code assistant} or {@code system}
 * @param content   content parts, each a map with at least a {@code type}
 * @param status    {@code completed}
 * @param createdAt epoch seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationItem(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("role") String role,
        @JsonProperty("content") List<Map<String, Object>> content,
        @JsonProperty("status") String status,
        @JsonProperty("created_at") long createdAt) {

    public ConversationItem {
        type = type == null ? "message" : type;
        status = status == null ? "completed" : status;
        content = content == null ? List.of() : List.copyOf(content);
    }
}

package com.devgate.gateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Something the debug server can execute: an agent or a workflow.
 *
 * @param id          stable identifier used as {@code entity_id}
 * @param type        {@code agent} or {@code workflow}
 * @param name        display name
 * @param description optional description
 * @param framework   framework that hosts the entity
 * @param tools       names of the tools the entity may call
 * @param source      where the entity came from ({@code in_memory}, {@code registered})
 * @param metadata    free-form attributes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityInfo(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("framework") String framework,
        @JsonProperty("tools") List<String> tools,
        @JsonProperty("source") String source,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public static final String TYPE_AGENT = "agent";
    public static final String TYPE_WORKFLOW = "workflow";

    public EntityInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == null || type.isBlank()) {
            type = TYPE_AGENT;
        }
        if (!TYPE_AGENT.equals(type) && !TYPE_WORKFLOW.equals(type)) {
            throw new IllegalArgumentException("type must be 'agent' or 'workflow', got '" + type + "'");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (framework == null) {
            framework = "devgate";
        }
        tools = tools == null ? List.of() : List.copyOf(tools);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

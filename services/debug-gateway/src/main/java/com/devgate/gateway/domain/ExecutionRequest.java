package com.devgate.gateway.domain;

import java.util.Map;

/**
 * A request to run an entity.
 *
 * @param entityId       entity to run
 * @param input          user input as plain text
 * @param conversationId conversation the exchange belongs to, if any
 * @param metadata       caller-supplied metadata, merged with the caller's identity attributes
 */
public record ExecutionRequest(
        String entityId, String input, String conversationId, Map<String, Object> metadata) {

    public ExecutionRequest {
        if (entityId == null || entityId.isBlank()) {
            throw new InvalidRequestException("entityId must not be null or blank");
        }
        input = input == null ? "" : input;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

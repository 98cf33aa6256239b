package com.devgate.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error body in the shape OpenAI-compatible clients expect:
 * {@code {"error": {"message": ..., "type": ..., "code": ...}}}.
 */
public record OpenAiError(@JsonProperty("error") Detail error) {

    public static final String INVALID_REQUEST = "invalid_request_error";
    public static final String SERVER_ERROR = "server_error";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(
            @JsonProperty("message") String message,
            @JsonProperty("type") String type,
            @JsonProperty("code") String code) {}

    public static ResponseEntity<Object> response(HttpStatus status, String type, String code, String message) {
        return ResponseEntity.status(status).body(new OpenAiError(new Detail(message, type, code)));
    }
}

package com.devgate.eventmodel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The whole of one execution, folded from its events.
 *
 * @param id         response id
 * @param object     always {@value #OBJECT}
 * @param createdAt  epoch seconds
 * @param model      entity that produced the response
 * @param status     {@value #STATUS_COMPLETED} or {@value #STATUS_FAILED}
 * @param outputText concatenated text deltas
 * @param toolCalls  tool invocations in call order, each with its result when one arrived
 * @param error      message of the last reported error, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateResponse(
        @JsonProperty("id") String id,
        @JsonProperty("object") String object,
        @JsonProperty("created_at") long createdAt,
        @JsonProperty("model") String model,
        @JsonProperty("status") String status,
        @JsonProperty("output_text") String outputText,
        @JsonProperty("tool_calls") List<ToolCall> toolCalls,
        @JsonProperty("error") String error
) {

    public static final String OBJECT = "response";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    public AggregateResponse {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (object == null) {
            object = OBJECT;
        }
        outputText = outputText == null ? "" : outputText;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    /**
     * A tool invocation and, once available, its output.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ToolCall(
            @JsonProperty("call_id") String callId,
            @JsonProperty("name") String name,
            @JsonProperty("arguments") String arguments,
            @JsonProperty("output") String output,
            @JsonProperty("status") String status
    ) {

        ToolCall withResult(String resultOutput, String resultStatus) {
            return new ToolCall(callId, name, arguments, resultOutput, resultStatus);
        }
    }
}

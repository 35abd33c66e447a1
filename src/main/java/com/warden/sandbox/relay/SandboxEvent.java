package com.warden.sandbox.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One event streamed back from a sandbox: {@code thought}, {@code tool_start},
 * {@code tool_end}, {@code question}, {@code result} or {@code error}.
 *
 * <p>A {@code question} event pauses the task until answers arrive through
 * {@link ExecutionRelay#answer}; the stream stays open meanwhile.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SandboxEvent(
        @JsonProperty("type") String type,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("thread_id") String threadId,
        @JsonProperty("timestamp") String timestamp
) {

    public static final String QUESTION = "question";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String INTERRUPTED = "interrupted";

    /** No further events follow a terminal event. */
    @JsonIgnore
    public boolean isTerminal() {
        return RESULT.equals(type) || ERROR.equals(type);
    }

    /** A result that reports the run was cancelled by an interrupt rather than completed. */
    @JsonIgnore
    public boolean isCancelled() {
        return RESULT.equals(type) && data != null && INTERRUPTED.equals(data.path("subtype").asText(null));
    }
}

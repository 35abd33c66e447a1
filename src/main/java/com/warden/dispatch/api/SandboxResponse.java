package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.sandbox.SandboxRecord;
import com.warden.sandbox.SandboxState;

import java.time.Instant;

/**
 * Outbound view of a sandbox. Deliberately has no field for the identity token.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SandboxResponse(
    String name,
    @JsonProperty("thread_id") String threadId,
    String namespace,
    @JsonProperty("created_at") Instant createdAt,
    SandboxState state
) {

    static SandboxResponse of(SandboxRecord record, SandboxState state) {
        return new SandboxResponse(record.name(), record.threadId(), record.namespace(), record.createdAt(), state);
    }
}

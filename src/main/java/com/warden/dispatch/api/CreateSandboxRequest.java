package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sandboxes.
 *
 * @param ttlMinutes sandbox lifetime; nullable, defaults to the configured TTL
 */
public record CreateSandboxRequest(
    @JsonProperty("thread_id") String threadId,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("team_id") String teamId,
    @JsonProperty("ttl_minutes") Integer ttlMinutes
) {}

package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.sandbox.relay.Attachment;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/sandboxes/{threadId}/execute.
 *
 * @param images optional base64 attachments passed through to the sandbox
 */
public record ExecuteRequest(
    String prompt,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("team_id") String teamId,
    List<Attachment> images
) {}

package com.warden.core.security;

import java.time.Instant;

/**
 * Identity bound into a sandbox token.
 *
 * <p>Only claims obtained from {@link SandboxTokenService#verify(String)} may be
 * used for authorization decisions.
 */
public record SandboxClaims(
        String issuer,
        String audience,
        Instant issuedAt,
        Instant expiresAt,
        String tenantId,
        String teamId,
        String sandboxName,
        String threadId
) {

    public static final String TENANT_ID = "tenant_id";
    public static final String TEAM_ID = "team_id";
    public static final String SANDBOX_NAME = "sandbox_name";
    public static final String THREAD_ID = "thread_id";

    /**
     * True when the four identity claims equal the given values.
     */
    public boolean identifies(String tenantId, String teamId, String sandboxName, String threadId) {
        return this.tenantId.equals(tenantId)
                && this.teamId.equals(teamId)
                && this.sandboxName.equals(sandboxName)
                && this.threadId.equals(threadId);
    }
}

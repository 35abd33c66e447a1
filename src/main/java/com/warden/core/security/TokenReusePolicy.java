package com.warden.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decides whether an existing identity token may be embedded in a new sandbox
 * for the same thread, or whether a fresh one has to be minted.
 *
 * <p>A candidate is reused only if it verifies, names exactly the requested
 * tenant/team/sandbox/thread and has at least {@code minRemaining} lifetime left.
 */
@Component
public class TokenReusePolicy {

    private static final Logger log = LoggerFactory.getLogger(TokenReusePolicy.class);

    private final SandboxTokenService tokenService;
    private final Duration minRemaining;

    @Autowired
    public TokenReusePolicy(SandboxTokenService tokenService, TokenProperties properties) {
        this(tokenService, properties.getReuseMinRemaining());
    }

    public TokenReusePolicy(SandboxTokenService tokenService, Duration minRemaining) {
        this.tokenService = tokenService;
        this.minRemaining = minRemaining != null ? minRemaining : Duration.ZERO;
    }

    /**
     * Returns a token for the requested identity: the candidate when it is safe to
     * reuse, otherwise a newly minted token valid for {@code ttl}.
     */
    public String resolve(String candidate, String tenantId, String teamId,
                          String sandboxName, String threadId, Duration ttl) {
        if (isReusable(candidate, tenantId, teamId, sandboxName, threadId)) {
            log.info("Reusing identity token for sandbox {}", sandboxName);
            return candidate;
        }
        return tokenService.mint(tenantId, teamId, sandboxName, threadId, ttl);
    }

    /**
     * @return the claims of {@code token} if it verifies, otherwise {@code null}
     */
    public SandboxClaims verifiedClaims(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return tokenService.verify(token);
    }

    boolean isReusable(String candidate, String tenantId, String teamId, String sandboxName, String threadId) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        SandboxClaims claims = tokenService.verify(candidate);
        if (claims == null) {
            log.warn("Discarding unverifiable identity token for sandbox {}", sandboxName);
            return false;
        }
        if (!claims.identifies(tenantId, teamId, sandboxName, threadId)) {
            log.warn("Discarding identity token for sandbox {}: claims do not match requested identity",
                    sandboxName);
            return false;
        }
        Duration remaining = tokenService.remainingLifetime(claims);
        if (remaining.compareTo(minRemaining) <= 0) {
            log.info("Rotating identity token for sandbox {} ({} min left)", sandboxName, remaining.toMinutes());
            return false;
        }
        return true;
    }
}

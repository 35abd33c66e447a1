package com.warden.core.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Mints and verifies the signed identity token that binds a sandbox to its
 * tenant, team and thread.
 *
 * <p>The signing secret is shared only with the credential resolver. The token is
 * embedded in the sandbox's proxy configuration as a static header, so the process
 * running inside the sandbox can neither read nor replace it.
 */
@Service
public class SandboxTokenService {

    private static final Logger log = LoggerFactory.getLogger(SandboxTokenService.class);

    static final int MIN_SECRET_BYTES = 32;

    private final SecretKey signingKey;
    private final String issuer;
    private final String audience;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public SandboxTokenService(TokenProperties properties) {
        this(properties.getSecret(), properties.getIssuer(), properties.getAudience(), Clock.systemUTC());
    }

    public SandboxTokenService(String secret, String issuer, String audience, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(
                    "Sandbox JWT secret is not configured. Set warden.security.jwt.secret (SANDBOX_JWT_SECRET).");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "Sandbox JWT secret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        this.signingKey = Keys.hmacShaKeyFor(secretBytes);
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
    }

    /**
     * Mints a token for a sandbox.
     *
     * @param ttl lifetime of the token; callers add a grace period on top of the sandbox TTL
     * @return compact signed JWT
     */
    public String mint(String tenantId, String teamId, String sandboxName, String threadId, Duration ttl) {
        requireText(tenantId, "tenantId");
        requireText(teamId, "teamId");
        requireText(sandboxName, "sandboxName");
        requireText(threadId, "threadId");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(issuer)
                .audience().add(audience).and()
                .subject(sandboxName)
                .claim(SandboxClaims.TENANT_ID, tenantId)
                .claim(SandboxClaims.TEAM_ID, teamId)
                .claim(SandboxClaims.SANDBOX_NAME, sandboxName)
                .claim(SandboxClaims.THREAD_ID, threadId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verifies signature, issuer, audience and expiry.
     *
     * @return the claims, or {@code null} if the token must not be trusted
     */
    public SandboxClaims verify(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .requireAudience(audience)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String tenantId = claims.get(SandboxClaims.TENANT_ID, String.class);
            String teamId = claims.get(SandboxClaims.TEAM_ID, String.class);
            String sandboxName = claims.get(SandboxClaims.SANDBOX_NAME, String.class);
            String threadId = claims.get(SandboxClaims.THREAD_ID, String.class);
            if (isBlank(tenantId) || isBlank(teamId) || isBlank(sandboxName) || isBlank(threadId)) {
                log.warn("Sandbox token is missing identity claims");
                return null;
            }

            return new SandboxClaims(
                    claims.getIssuer(),
                    audience,
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration().toInstant(),
                    tenantId, teamId, sandboxName, threadId);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Sandbox token rejected: {}", e.getClass().getSimpleName());
            return null;
        }
    }

    /**
     * Decodes the payload without checking the signature. For diagnostics only.
     *
     * @throws IllegalArgumentException if the token is not a decodable JWT
     */
    public SandboxClaims inspectUnverified(String token) {
        if (token == null) {
            throw new IllegalArgumentException("token is null");
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Not a JWT: expected header.payload.signature");
        }
        try {
            JsonNode payload = objectMapper.readTree(Decoders.BASE64URL.decode(parts[1]));
            return new SandboxClaims(
                    text(payload, "iss"),
                    audienceOf(payload.get("aud")),
                    epochSeconds(payload, "iat"),
                    epochSeconds(payload, "exp"),
                    text(payload, SandboxClaims.TENANT_ID),
                    text(payload, SandboxClaims.TEAM_ID),
                    text(payload, SandboxClaims.SANDBOX_NAME),
                    text(payload, SandboxClaims.THREAD_ID));
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Cannot decode token payload", e);
        }
    }

    /**
     * Remaining lifetime of a verified token, zero if already expired.
     */
    public Duration remainingLifetime(SandboxClaims claims) {
        Duration remaining = Duration.between(clock.instant(), claims.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private static String audienceOf(JsonNode aud) {
        if (aud == null || aud.isNull()) {
            return null;
        }
        if (aud.isArray()) {
            return aud.isEmpty() ? null : aud.get(0).asText();
        }
        return aud.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant epochSeconds(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.canConvertToLong() ? null : Instant.ofEpochSecond(value.asLong());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void requireText(String value, String name) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}

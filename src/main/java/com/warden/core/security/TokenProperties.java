package com.warden.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "warden.security.jwt")
public class TokenProperties {

    /** HMAC secret shared with the credential resolver. Never shipped to sandboxes. */
    private String secret = "";

    private String issuer = "warden";

    private String audience = "credential-resolver";

    /** A remembered or caller-supplied token is only reused with at least this much lifetime left. */
    private Duration reuseMinRemaining = Duration.ofMinutes(30);

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public Duration getReuseMinRemaining() {
        return reuseMinRemaining;
    }

    public void setReuseMinRemaining(Duration reuseMinRemaining) {
        this.reuseMinRemaining = reuseMinRemaining;
    }
}

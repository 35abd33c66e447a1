package com.warden.sandbox.k8s;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the Kubernetes API.
 *
 * <p>Defaults target in-cluster use with the pod's service account. For local work,
 * point {@code api-url} at {@code kubectl proxy} (plain HTTP, no token needed).
 */
@Component
@ConfigurationProperties(prefix = "warden.kubernetes")
public class KubernetesProperties {

    public static final String SERVICE_ACCOUNT_DIR = "/var/run/secrets/kubernetes.io/serviceaccount";

    private String apiUrl = "https://kubernetes.default.svc";

    /** Static bearer token. Takes precedence over {@link #tokenPath}. */
    private String token = "";

    private String tokenPath = SERVICE_ACCOUNT_DIR + "/token";

    private String caPath = SERVICE_ACCOUNT_DIR + "/ca.crt";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration requestTimeout = Duration.ofSeconds(30);

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getTokenPath() {
        return tokenPath;
    }

    public void setTokenPath(String tokenPath) {
        this.tokenPath = tokenPath;
    }

    public String getCaPath() {
        return caPath;
    }

    public void setCaPath(String caPath) {
        this.caPath = caPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}

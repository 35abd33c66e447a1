package com.warden.sandbox.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * HTTP client for the Kubernetes REST API.
 *
 * <p>Covers ConfigMaps, pods and the {@code agents.x-k8s.io/v1alpha1} Sandbox custom
 * resource. Every request carries the configured request timeout; a request that runs
 * out of time raises {@link ClusterTimeoutException}, an error status raises
 * {@link ClusterApiException}.
 */
public class KubernetesApiClient implements ClusterClient {

    private static final Logger log = LoggerFactory.getLogger(KubernetesApiClient.class);

    public static final String SANDBOX_GROUP = "agents.x-k8s.io";
    public static final String SANDBOX_VERSION = "v1alpha1";
    public static final String SANDBOX_PLURAL = "sandboxes";

    private static final String MERGE_PATCH = "application/merge-patch+json";

    private final String apiUrl;
    private final Supplier<String> tokenSupplier;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public KubernetesApiClient(String apiUrl, Supplier<String> tokenSupplier,
                               HttpClient httpClient, Duration requestTimeout) {
        this.apiUrl = stripTrailingSlash(apiUrl);
        this.tokenSupplier = tokenSupplier;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Builds a client from configuration, trusting the service-account CA when present.
     *
     * @throws IllegalStateException if an HTTPS API is configured without any credentials
     */
    public static KubernetesApiClient fromProperties(KubernetesProperties properties) {
        var apiUrl = properties.getApiUrl();
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalStateException("Kubernetes API URL is not configured (warden.kubernetes.api-url)");
        }

        var builder = HttpClient.newBuilder().connectTimeout(properties.getConnectTimeout());
        var caPath = properties.getCaPath() == null ? null : Path.of(properties.getCaPath());
        if (apiUrl.startsWith("https") && caPath != null && Files.isReadable(caPath)) {
            builder.sslContext(sslContextTrusting(caPath));
        }

        Supplier<String> tokenSupplier = tokenSupplier(properties);
        if (apiUrl.startsWith("https") && tokenSupplier.get() == null) {
            throw new IllegalStateException(
                    "No Kubernetes credentials: set warden.kubernetes.token or mount a service account token at "
                            + properties.getTokenPath());
        }

        log.info("Kubernetes API client targeting {}", apiUrl);
        return new KubernetesApiClient(apiUrl, tokenSupplier, builder.build(), properties.getRequestTimeout());
    }

    @Override
    public JsonNode createConfigMap(String namespace, ObjectNode configMap) {
        var name = configMap.path("metadata").path("name").asText();
        return send("POST", configMapsPath(namespace), configMap.toString(), "application/json",
                "configmap/" + name);
    }

    @Override
    public JsonNode replaceConfigMap(String namespace, String name, ObjectNode configMap) {
        return send("PUT", configMapsPath(namespace) + "/" + segment(name), configMap.toString(), "application/json",
                "configmap/" + name);
    }

    @Override
    public void deleteConfigMap(String namespace, String name) {
        send("DELETE", configMapsPath(namespace) + "/" + segment(name), null, null, "configmap/" + name);
    }

    @Override
    public JsonNode createSandbox(String namespace, ObjectNode sandbox) {
        var name = sandbox.path("metadata").path("name").asText();
        return send("POST", sandboxesPath(namespace), sandbox.toString(), "application/json",
                "sandbox/" + name);
    }

    @Override
    public JsonNode getSandbox(String namespace, String name) {
        return send("GET", sandboxesPath(namespace) + "/" + segment(name), null, null, "sandbox/" + name);
    }

    @Override
    public JsonNode patchSandbox(String namespace, String name, ObjectNode mergePatch) {
        return send("PATCH", sandboxesPath(namespace) + "/" + segment(name), mergePatch.toString(), MERGE_PATCH,
                "sandbox/" + name);
    }

    @Override
    public void deleteSandbox(String namespace, String name) {
        send("DELETE", sandboxesPath(namespace) + "/" + segment(name), null, null, "sandbox/" + name);
    }

    @Override
    public List<PodState> listPods(String namespace, String labelSelector) {
        var path = "/api/v1/namespaces/%s/pods?labelSelector=%s".formatted(segment(namespace), encode(labelSelector));
        var response = send("GET", path, null, null, "pods{" + labelSelector + "}");
        var pods = new ArrayList<PodState>();
        for (JsonNode item : response.path("items")) {
            pods.add(PodState.fromJson(item));
        }
        return pods;
    }

    JsonNode send(String method, String path, String body, String contentType, String resource) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        var token = tokenSupplier.get();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        if (body != null) {
            builder.header("Content-Type", contentType);
            builder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ClusterApiException(response.statusCode(), method, resource, response.body());
            }
            var responseBody = response.body();
            return responseBody == null || responseBody.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(responseBody);
        } catch (HttpTimeoutException e) {
            throw new ClusterTimeoutException(
                    "Cluster API %s %s timed out after %ss".formatted(method, resource, requestTimeout.toSeconds()), e);
        } catch (IOException e) {
            throw new ClusterException("Cluster API request failed: %s %s".formatted(method, resource), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterException("Interrupted during cluster API call: %s %s".formatted(method, resource), e);
        }
    }

    private static String configMapsPath(String namespace) {
        return "/api/v1/namespaces/%s/configmaps".formatted(segment(namespace));
    }

    private static String sandboxesPath(String namespace) {
        return "/apis/%s/%s/namespaces/%s/%s".formatted(SANDBOX_GROUP, SANDBOX_VERSION, segment(namespace),
                SANDBOX_PLURAL);
    }

    private static Supplier<String> tokenSupplier(KubernetesProperties properties) {
        var staticToken = properties.getToken();
        if (staticToken != null && !staticToken.isBlank()) {
            return () -> staticToken;
        }
        if (properties.getTokenPath() == null || properties.getTokenPath().isBlank()) {
            return () -> null;
        }
        var tokenPath = Path.of(properties.getTokenPath());
        // Projected service account tokens are rotated on disk, so read on every call.
        return () -> {
            if (!Files.isReadable(tokenPath)) {
                return null;
            }
            try {
                return Files.readString(tokenPath).trim();
            } catch (IOException e) {
                throw new ClusterException("Cannot read service account token from " + tokenPath, e);
            }
        };
    }

    private static SSLContext sslContextTrusting(Path caPath) {
        try (InputStream in = Files.newInputStream(caPath)) {
            var keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            var index = 0;
            for (Certificate certificate : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                keyStore.setCertificateEntry("k8s-ca-" + index++, certificate);
            }
            var trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            var context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot load Kubernetes CA certificate from " + caPath, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Percent-encodes a single path segment, so names cannot add segments or a query. */
    static String segment(String value) {
        return encode(value).replace("+", "%20");
    }
}

package com.warden.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.security.TokenReusePolicy;
import com.warden.sandbox.k8s.ClusterApiException;
import com.warden.sandbox.k8s.ClusterClient;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.k8s.PodState;
import com.warden.sandbox.proxy.ProxyConfig;
import com.warden.sandbox.proxy.ProxyConfigGenerator;
import com.warden.sandbox.proxy.ProxyConfigInspector;
import com.warden.sandbox.relay.ExecutionRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Creates, inspects and tears down sandboxes.
 *
 * <p>Each sandbox is named after its thread, so repeated or concurrent calls for the same
 * thread address the same cluster objects. Creation writes the proxy ConfigMap first and
 * the Sandbox resource second; an existing ConfigMap is replaced and an existing Sandbox
 * is adopted. The cluster removes a sandbox on its own once {@code spec.shutdownTime}
 * passes, independently of {@link #delete(String)}.
 *
 * <p>Cluster calls are synchronous. {@link #waitForReady(String, Duration)} is the only
 * blocking loop.
 */
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    /** Tokens outlive their sandbox by this much so in-flight requests are not cut off. */
    static final Duration TOKEN_GRACE = Duration.ofHours(1);

    private final ClusterClient cluster;
    private final TokenReusePolicy tokenPolicy;
    private final ProxyConfigGenerator proxyConfigGenerator;
    private final SandboxManifestBuilder manifests;
    private final ExecutionRelay relay;
    private final IntegrationCatalogClient integrationCatalog;
    private final SandboxProperties properties;
    private final Clock clock;
    private final WardenMetrics metrics;

    private final Map<String, String> tokensByThread = new ConcurrentHashMap<>();

    /**
     * @param metrics may be {@code null}
     */
    public SandboxManager(ClusterClient cluster, TokenReusePolicy tokenPolicy,
                          ProxyConfigGenerator proxyConfigGenerator, SandboxManifestBuilder manifests,
                          ExecutionRelay relay, IntegrationCatalogClient integrationCatalog,
                          SandboxProperties properties, Clock clock, WardenMetrics metrics) {
        this.cluster = cluster;
        this.tokenPolicy = tokenPolicy;
        this.proxyConfigGenerator = proxyConfigGenerator;
        this.manifests = manifests;
        this.relay = relay;
        this.integrationCatalog = integrationCatalog;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Creates the sandbox for a thread, or adopts it if it already exists.
     *
     * @param ttl         sandbox lifetime; {@code null} uses the configured default
     * @param reusedToken identity token from an earlier sandbox of this thread, may be {@code null}
     * @throws ClusterException          on any cluster failure other than "already exists"
     * @throws SandboxOwnershipException if the thread's sandbox belongs to another tenant or team
     */
    public SandboxRecord create(String threadId, String tenantId, String teamId, Duration ttl, String reusedToken) {
        SandboxRecord.requireValidThreadId(threadId);
        requireText(tenantId, "tenantId");
        requireText(teamId, "teamId");
        var lifetime = ttl != null ? ttl : properties.getTtl();
        if (lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        var namespace = properties.getNamespace();
        var sandboxName = SandboxRecord.nameFor(threadId);
        MdcContext.setSandbox(threadId, sandboxName);
        try {
            var existing = findSandbox(namespace, sandboxName);
            if (existing != null && !annotatedFor(existing, tenantId, teamId)) {
                log.warn("Sandbox {} exists for another tenant or team, not touching it", sandboxName);
                throw new SandboxOwnershipException(threadId);
            }

            var candidate = reusedToken != null ? reusedToken : tokensByThread.get(threadId);
            var token = tokenPolicy.resolve(candidate, tenantId, teamId, sandboxName, threadId,
                    lifetime.plus(TOKEN_GRACE));

            var integrations = integrationCatalog.fetchConfiguredIntegrations(token, tenantId, teamId);
            var upstreams = properties.upstreams();
            var proxyConfig = proxyConfigGenerator.generate(sandboxName, token, upstreams);
            if (ProxyConfigInspector.of(proxyConfig.document()).forwardsOnAuthorizationFailure()) {
                throw new IllegalStateException("Refusing fail-open proxy configuration for " + sandboxName);
            }
            upsertProxyConfig(namespace, sandboxName, proxyConfig);

            ObjectNode manifest = manifests.sandbox(namespace, sandboxName, threadId, tenantId, teamId,
                    integrations, proxyConfig.name(), lifetime, upstreams);
            Instant createdAt;
            String outcome;
            try {
                createdAt = creationTimestamp(cluster.createSandbox(namespace, manifest));
                outcome = "created";
                log.info("Created sandbox {} in {} (ttl {}m, gvisor={})",
                        sandboxName, namespace, lifetime.toMinutes(), properties.isGvisorEnabled());
            } catch (ClusterApiException e) {
                if (!e.isConflict()) {
                    throw e;
                }
                var adopted = cluster.getSandbox(namespace, sandboxName);
                if (!annotatedFor(adopted, tenantId, teamId)) {
                    log.error("Sandbox {} was created concurrently for another tenant or team", sandboxName);
                    throw new SandboxOwnershipException(threadId);
                }
                createdAt = creationTimestamp(adopted);
                outcome = "adopted";
                log.info("Sandbox {} already exists, adopting it", sandboxName);
            }

            tokensByThread.put(threadId, token);
            if (metrics != null) {
                metrics.recordSandboxCreated(outcome);
            }
            return new SandboxRecord(sandboxName, threadId, namespace, createdAt, token);
        } catch (RuntimeException e) {
            if (metrics != null) {
                metrics.recordSandboxCreated("failed");
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * @return the sandbox for the thread, or {@code null} if none exists
     */
    public SandboxRecord get(String threadId) {
        var sandboxName = SandboxRecord.nameFor(threadId);
        var sandbox = findSandbox(properties.getNamespace(), sandboxName);
        if (sandbox == null) {
            return null;
        }
        return new SandboxRecord(sandboxName, threadId, properties.getNamespace(),
                creationTimestamp(sandbox), tokensByThread.get(threadId));
    }

    /**
     * True when the sandbox was provisioned for {@code tenantId} and {@code teamId}. A
     * remembered token that still verifies decides; otherwise the tenant annotations on the
     * Sandbox resource do. A sandbox without annotations belongs to nobody.
     */
    public boolean isOwnedBy(SandboxRecord sandbox, String tenantId, String teamId) {
        var claims = tokenPolicy.verifiedClaims(sandbox.identityToken());
        if (claims != null) {
            return claims.identifies(tenantId, teamId, sandbox.name(), sandbox.threadId());
        }
        var resource = findSandbox(sandbox.namespace(), sandbox.name());
        return resource != null && annotatedFor(resource, tenantId, teamId);
    }

    /**
     * Polls until a pod of the sandbox is running and ready and its server answers the
     * health probe.
     *
     * @return {@code false} if the sandbox was not ready within {@code timeout} or the wait was interrupted
     */
    public boolean waitForReady(String threadId, Duration timeout) {
        var sandboxName = SandboxRecord.nameFor(threadId);
        var probe = new SandboxRecord(sandboxName, threadId, properties.getNamespace(), null, null);
        var selector = SandboxManifestBuilder.threadSelector(threadId);
        var pollMillis = Math.max(1L, properties.getPollInterval().toMillis());

        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            try {
                var pods = cluster.listPods(properties.getNamespace(), selector);
                if (pods.stream().anyMatch(PodState::isRunningAndReady) && relay.isHealthy(probe)) {
                    var elapsed = Duration.ofNanos(System.nanoTime() - start);
                    log.info("Sandbox {} ready after {}ms", sandboxName, elapsed.toMillis());
                    if (metrics != null) {
                        metrics.recordReadyDuration(elapsed);
                    }
                    return true;
                }
                log.debug("Sandbox {} not ready yet, polling in {}ms", sandboxName, pollMillis);
            } catch (ClusterException e) {
                log.warn("Error polling sandbox {} readiness: {}", sandboxName, e.getMessage());
            }

            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(pollMillis, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for sandbox {}", sandboxName);
                return false;
            }
        }

        log.warn("Sandbox {} not ready after {}s", sandboxName, timeout.toSeconds());
        if (metrics != null) {
            metrics.recordReadyTimeout();
        }
        return false;
    }

    /**
     * Deletes the sandbox and its proxy configuration. Deleting a sandbox that does not
     * exist succeeds.
     */
    public void delete(String threadId) {
        var namespace = properties.getNamespace();
        var sandboxName = SandboxRecord.nameFor(threadId);
        MdcContext.setSandbox(threadId, sandboxName);
        try {
            try {
                cluster.deleteSandbox(namespace, sandboxName);
            } catch (ClusterApiException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                log.debug("Sandbox {} already gone", sandboxName);
            }
            try {
                cluster.deleteConfigMap(namespace, ProxyConfig.nameFor(sandboxName));
            } catch (ClusterApiException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                log.debug("Proxy config for {} already gone", sandboxName);
            }
            tokensByThread.remove(threadId);
            if (metrics != null) {
                metrics.recordSandboxDeleted();
            }
            log.info("Deleted sandbox {}", sandboxName);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Moves the sandbox's shutdown time to now + {@code ttl}.
     *
     * @return {@code false} if the sandbox does not exist
     */
    public boolean extendTtl(String threadId, Duration ttl) {
        var sandboxName = SandboxRecord.nameFor(threadId);
        var lifetime = ttl != null ? ttl : properties.getTtl();
        try {
            cluster.patchSandbox(properties.getNamespace(), sandboxName, manifests.shutdownPatch(lifetime));
        } catch (ClusterApiException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
        log.info("Extended sandbox {} by {}m", sandboxName, lifetime.toMinutes());
        return true;
    }

    public SandboxState state(String threadId) {
        var namespace = properties.getNamespace();
        var sandboxName = SandboxRecord.nameFor(threadId);
        JsonNode sandbox;
        try {
            sandbox = cluster.getSandbox(namespace, sandboxName);
        } catch (ClusterApiException e) {
            if (e.isNotFound()) {
                return SandboxState.ABSENT;
            }
            throw e;
        }

        if (sandbox.path("metadata").hasNonNull("deletionTimestamp")) {
            return SandboxState.TERMINATING;
        }
        var shutdownTime = parseInstant(sandbox.path("spec").path("shutdownTime").asText(null));
        if (shutdownTime != null && !clock.instant().isBefore(shutdownTime)) {
            return SandboxState.EXPIRED;
        }
        var pods = cluster.listPods(namespace, SandboxManifestBuilder.threadSelector(threadId));
        return pods.stream().anyMatch(PodState::isRunningAndReady) ? SandboxState.READY : SandboxState.CREATING;
    }

    /** Identity token remembered for a thread, if this process created its sandbox. */
    String rememberedToken(String threadId) {
        return tokensByThread.get(threadId);
    }

    private JsonNode findSandbox(String namespace, String sandboxName) {
        try {
            return cluster.getSandbox(namespace, sandboxName);
        } catch (ClusterApiException e) {
            if (e.isNotFound()) {
                return null;
            }
            throw e;
        }
    }

    private static boolean annotatedFor(JsonNode sandbox, String tenantId, String teamId) {
        if (tenantId == null || teamId == null) {
            return false;
        }
        var annotations = sandbox.path("metadata").path("annotations");
        return tenantId.equals(annotations.path(SandboxManifestBuilder.TENANT_ANNOTATION).asText(null))
                && teamId.equals(annotations.path(SandboxManifestBuilder.TEAM_ANNOTATION).asText(null));
    }

    private void upsertProxyConfig(String namespace, String sandboxName, ProxyConfig config) {
        var configMap = manifests.configMap(namespace, sandboxName, config);
        try {
            cluster.createConfigMap(namespace, configMap);
            recordUpsert("create");
        } catch (ClusterApiException e) {
            if (!e.isConflict()) {
                throw e;
            }
            log.info("Proxy config {} exists, replacing it", config.name());
            cluster.replaceConfigMap(namespace, config.name(), configMap);
            recordUpsert("replace");
        }
    }

    private void recordUpsert(String mode) {
        if (metrics != null) {
            metrics.recordProxyConfigUpsert(mode);
        }
    }

    private Instant creationTimestamp(JsonNode resource) {
        var created = parseInstant(resource.path("metadata").path("creationTimestamp").asText(null));
        return created != null ? created : clock.instant();
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed timestamp '{}'", value);
            return null;
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}

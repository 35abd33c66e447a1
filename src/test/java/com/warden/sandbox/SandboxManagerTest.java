package com.warden.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.security.SandboxTokenService;
import com.warden.core.security.TokenReusePolicy;
import com.warden.sandbox.k8s.ClusterApiException;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.k8s.PodState;
import com.warden.sandbox.proxy.ProxyConfig;
import com.warden.sandbox.proxy.ProxyConfigGenerator;
import com.warden.sandbox.relay.ExecutionRelay;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SandboxManagerTest {

    private static final String SECRET = "warden-test-secret-must-be-at-least-32-bytes-long";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String NAMESPACE = "sandboxes";

    private FakeClusterClient cluster;
    private SandboxTokenService tokens;
    private ExecutionRelay relay;
    private IntegrationCatalogClient catalog;
    private SandboxProperties properties;
    private SimpleMeterRegistry registry;
    private SandboxManager manager;

    @BeforeEach
    void setUp() {
        cluster = new FakeClusterClient();
        tokens = new SandboxTokenService(SECRET, "warden", "credential-resolver", Clock.systemUTC());
        relay = mock(ExecutionRelay.class);
        catalog = mock(IntegrationCatalogClient.class);
        when(catalog.fetchConfiguredIntegrations(any(), any(), any())).thenReturn("[{\"name\":\"github\"}]");

        properties = new SandboxProperties();
        properties.setNamespace(NAMESPACE);
        properties.setPollInterval(Duration.ofMillis(10));
        registry = new SimpleMeterRegistry();
        manager = managerAt(Clock.fixed(NOW, ZoneOffset.UTC), generator());
    }

    private ProxyConfigGenerator generator() {
        return new ProxyConfigGenerator(URI.create("http://resolver:8002"), Duration.ofSeconds(2));
    }

    private SandboxManager managerAt(Clock clock, ProxyConfigGenerator generator) {
        return new SandboxManager(cluster, new TokenReusePolicy(tokens, Duration.ofMinutes(30)), generator,
                new SandboxManifestBuilder(properties, clock), relay, catalog, properties, clock,
                new WardenMetrics(registry));
    }

    private static Map<String, String> agentEnv(JsonNode sandbox) {
        var env = new HashMap<String, String>();
        JsonNode agent = sandbox.path("spec").path("podTemplate").path("spec").path("containers").get(0);
        agent.path("env").forEach(e -> env.put(e.path("name").asText(), e.path("value").asText()));
        return env;
    }

    private double counter(String name, String tag, String value) {
        var meter = registry.find(name).tag(tag, value).counter();
        return meter == null ? 0 : meter.count();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("writes the proxy ConfigMap and the Sandbox named after the thread")
        void createsBothObjects() {
            var record = manager.create("t1", "abc", "g1", null, null);

            assertEquals("investigation-t1", record.name());
            assertEquals("t1", record.threadId());
            assertEquals(NAMESPACE, record.namespace());
            assertEquals(Instant.parse("2026-03-01T12:00:00Z"), record.createdAt());
            assertNotNull(cluster.configMap(NAMESPACE, "envoy-config-investigation-t1"));
            var sandbox = cluster.sandbox(NAMESPACE, "investigation-t1");
            assertNotNull(sandbox);
            assertEquals("2026-03-01T12:00:00Z", sandbox.path("spec").path("shutdownTime").asText());
            assertEquals("envoy-config-investigation-t1", sandbox.path("spec").path("podTemplate").path("spec")
                    .path("volumes").get(0).path("configMap").path("name").asText());
            assertEquals(1, counter("warden.sandbox.created", "outcome", "created"));
        }

        @Test
        @DisplayName("token carries the requested identity and lives only in the proxy config")
        void tokenPlacement() {
            var record = manager.create("t1", "abc", "g1", Duration.ofMinutes(60), null);

            var claims = tokens.verify(record.identityToken());
            assertNotNull(claims);
            assertTrue(claims.identifies("abc", "g1", "investigation-t1", "t1"));
            assertTrue(tokens.remainingLifetime(claims).compareTo(Duration.ofMinutes(119)) > 0);

            var document = cluster.configMap(NAMESPACE, "envoy-config-investigation-t1")
                    .path("data").path(ProxyConfig.CONFIG_KEY).asText();
            assertTrue(document.contains(record.identityToken()));
            var sandboxJson = cluster.sandbox(NAMESPACE, "investigation-t1").toString();
            assertFalse(sandboxJson.contains(record.identityToken()));
            assertFalse(record.toString().contains(record.identityToken()));
        }

        @Test
        @DisplayName("agent receives tenant context, integrations and proxy base URLs")
        void agentEnvironment() {
            manager.create("t1", "abc", "g1", null, null);

            var env = agentEnv(cluster.sandbox(NAMESPACE, "investigation-t1"));
            assertEquals("abc", env.get("WARDEN_TENANT_ID"));
            assertEquals("g1", env.get("WARDEN_TEAM_ID"));
            assertEquals("t1", env.get("THREAD_ID"));
            assertEquals("[{\"name\":\"github\"}]", env.get("CONFIGURED_INTEGRATIONS"));
            assertEquals("http://localhost:8001", env.get("ANTHROPIC_BASE_URL"));
            assertEquals("http://localhost:8001", env.get("CORALOGIX_BASE_URL"));
        }

        @Test
        @DisplayName("creating twice leaves one ConfigMap and one Sandbox")
        void idempotent() {
            var first = manager.create("t1", "abc", "g1", null, null);
            var second = manager.create("t1", "abc", "g1", null, null);

            assertEquals(first.name(), second.name());
            assertEquals(1, cluster.sandboxes.size());
            assertEquals(1, cluster.configMaps.size());
            assertEquals(1, cluster.sandboxCreates.get());
            assertEquals(1, cluster.configMapReplaces.get());
            assertEquals(first.identityToken(), second.identityToken());
            assertEquals(1, counter("warden.sandbox.created", "outcome", "adopted"));
        }

        @Test
        @DisplayName("concurrent creates for one thread converge on one sandbox")
        void concurrent() throws Exception {
            var pool = Executors.newFixedThreadPool(8);
            try {
                var tasks = new ArrayList<Callable<SandboxRecord>>();
                for (int i = 0; i < 8; i++) {
                    tasks.add(() -> manager.create("t1", "abc", "g1", null, null));
                }
                for (var future : pool.invokeAll(tasks)) {
                    assertEquals("investigation-t1", future.get().name());
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, cluster.sandboxes.size());
            assertEquals(1, cluster.configMaps.size());
            assertEquals(1, cluster.sandboxCreates.get());
        }

        @Test
        @DisplayName("an explicitly reused token is kept when it still matches")
        void reusedToken() {
            String earlier = tokens.mint("abc", "g1", "investigation-t1", "t1", Duration.ofHours(3));

            var record = manager.create("t1", "abc", "g1", null, earlier);

            assertEquals(earlier, record.identityToken());
        }

        @Test
        @DisplayName("refuses a fail-open proxy configuration before touching the cluster")
        void refusesFailOpen() {
            var generator = mock(ProxyConfigGenerator.class);
            when(generator.generate(any(), any(), anyList())).thenReturn(
                    new ProxyConfig("envoy-config-investigation-t1", "static_resources:\n  listeners: []\n"));
            var failOpen = managerAt(Clock.fixed(NOW, ZoneOffset.UTC), generator);

            assertThrows(IllegalStateException.class, () -> failOpen.create("t1", "abc", "g1", null, null));
            assertTrue(cluster.configMaps.isEmpty());
            assertTrue(cluster.sandboxes.isEmpty());
            assertEquals(1, counter("warden.sandbox.created", "outcome", "failed"));
        }

        @Test
        @DisplayName("cluster errors other than conflicts propagate")
        void propagatesErrors() {
            cluster.createSandboxFailure = new ClusterApiException(403, "POST", "sandbox/investigation-t1", "Forbidden");

            var e = assertThrows(ClusterApiException.class, () -> manager.create("t1", "abc", "g1", null, null));
            assertEquals(403, e.getStatusCode());
        }

        @Test
        @DisplayName("rejects blank identity and non-positive ttl")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> manager.create(" ", "abc", "g1", null, null));
            assertThrows(IllegalArgumentException.class, () -> manager.create("t1", null, "g1", null, null));
            assertThrows(IllegalArgumentException.class,
                    () -> manager.create("t1", "abc", "g1", Duration.ZERO, null));
            assertTrue(cluster.sandboxes.isEmpty());
        }
    }

    @Nested
    @DisplayName("thread id validation")
    class ThreadIdValidation {

        private static final String HOSTILE = "abc?dryRun=All&x=";

        @Test
        @DisplayName("every operation rejects ids that would alter API paths")
        void rejectsHostileIds() {
            manager.create("abc", "t1", "g1", null, null);

            assertThrows(IllegalArgumentException.class, () -> manager.create(HOSTILE, "t1", "g1", null, null));
            assertThrows(IllegalArgumentException.class, () -> manager.get(HOSTILE));
            assertThrows(IllegalArgumentException.class, () -> manager.delete(HOSTILE));
            assertThrows(IllegalArgumentException.class, () -> manager.waitForReady(HOSTILE, Duration.ofMillis(50)));
            assertThrows(IllegalArgumentException.class, () -> manager.extendTtl(HOSTILE, Duration.ofHours(1)));
            assertThrows(IllegalArgumentException.class, () -> manager.state(HOSTILE));

            assertNotNull(cluster.sandbox(NAMESPACE, "investigation-abc"));
            assertNotNull(cluster.configMap(NAMESPACE, "envoy-config-investigation-abc"));
            assertNull(registry.find("warden.sandbox.deleted").counter());
        }

        @Test
        @DisplayName("a comma cannot widen the readiness selector")
        void rejectsSelectorInjection() {
            assertThrows(IllegalArgumentException.class,
                    () -> manager.waitForReady("t1,app=warden-sandbox", Duration.ofMillis(50)));
            verify(relay, never()).isHealthy(any());
        }
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        @DisplayName("tenant and team are recorded on the Sandbox resource")
        void annotations() {
            manager.create("t1", "abc", "g1", null, null);

            var annotations = cluster.sandbox(NAMESPACE, "investigation-t1").path("metadata").path("annotations");
            assertEquals("abc", annotations.path(SandboxManifestBuilder.TENANT_ANNOTATION).asText());
            assertEquals("g1", annotations.path(SandboxManifestBuilder.TEAM_ANNOTATION).asText());
        }

        @Test
        @DisplayName("creating another tenant's thread leaves its sandbox and proxy config alone")
        void createForOtherTenant() {
            var original = manager.create("t1", "abc", "g1", null, null);

            assertThrows(SandboxOwnershipException.class, () -> manager.create("t1", "xyz", "g1", null, null));
            assertThrows(SandboxOwnershipException.class, () -> manager.create("t1", "abc", "g2", null, null));

            assertEquals(0, cluster.configMapReplaces.get());
            assertTrue(cluster.configMap(NAMESPACE, "envoy-config-investigation-t1")
                    .path("data").path(ProxyConfig.CONFIG_KEY).asText().contains(original.identityToken()));
            assertEquals(original.identityToken(), manager.rememberedToken("t1"));
        }

        @Test
        @DisplayName("the remembered token decides ownership")
        void byToken() {
            manager.create("t1", "abc", "g1", null, null);
            var record = manager.get("t1");

            assertTrue(manager.isOwnedBy(record, "abc", "g1"));
            assertFalse(manager.isOwnedBy(record, "xyz", "g1"));
            assertFalse(manager.isOwnedBy(record, "abc", "g2"));
        }

        @Test
        @DisplayName("without a usable token the resource annotations decide")
        void byAnnotations() {
            manager.create("t1", "abc", "g1", null, null);
            var withoutToken = new SandboxRecord("investigation-t1", "t1", NAMESPACE, NOW, null);
            var forgedToken = new SandboxRecord("investigation-t1", "t1", NAMESPACE, NOW, "not-a-jwt");

            assertTrue(manager.isOwnedBy(withoutToken, "abc", "g1"));
            assertFalse(manager.isOwnedBy(withoutToken, "xyz", "g1"));
            assertTrue(manager.isOwnedBy(forgedToken, "abc", "g1"));
            assertFalse(manager.isOwnedBy(forgedToken, "xyz", "g1"));
        }

        @Test
        @DisplayName("a sandbox without tenant annotations belongs to nobody")
        void unannotated() {
            manager.create("t1", "abc", "g1", null, null);
            ((ObjectNode) cluster.sandbox(NAMESPACE, "investigation-t1").path("metadata")).remove("annotations");
            var withoutToken = new SandboxRecord("investigation-t1", "t1", NAMESPACE, NOW, null);

            assertFalse(manager.isOwnedBy(withoutToken, "abc", "g1"));
        }
    }

    @Nested
    @DisplayName("get and delete")
    class GetAndDelete {

        @Test
        @DisplayName("create, get, delete, get")
        void lifecycle() {
            manager.create("t1", "abc", "g1", null, null);

            var found = manager.get("t1");
            assertNotNull(found);
            assertEquals("investigation-t1", found.name());
            assertNotNull(found.identityToken());

            manager.delete("t1");

            assertNull(manager.get("t1"));
            assertTrue(cluster.configMaps.isEmpty());
            assertNull(manager.rememberedToken("t1"));
        }

        @Test
        @DisplayName("sandbox name is derived from the thread id only")
        void deterministicName() {
            var record = manager.create("abc", "t1", "g1", null, null);

            assertEquals("investigation-abc", record.name());
            assertEquals("abc", manager.get("abc").threadId());

            manager.delete("abc");
            assertNull(manager.get("abc"));
        }

        @Test
        @DisplayName("deleting a missing sandbox succeeds")
        void deleteMissing() {
            assertDoesNotThrow(() -> manager.delete("never-created"));
            assertDoesNotThrow(() -> manager.delete("never-created"));
        }

        @Test
        @DisplayName("get of an unknown thread is null")
        void getMissing() {
            assertNull(manager.get("nope"));
        }
    }

    @Nested
    @DisplayName("waitForReady")
    class WaitForReady {

        @Test
        @DisplayName("true once a pod is ready and the server answers")
        void ready() {
            manager.create("t1", "abc", "g1", null, null);
            cluster.pods.add(new PodState("investigation-t1-abc", "Running", true));
            when(relay.isHealthy(any())).thenReturn(true);

            assertTrue(manager.waitForReady("t1", Duration.ofSeconds(5)));
            assertEquals(1, registry.find("warden.sandbox.ready.duration").timer().count());
        }

        @Test
        @DisplayName("false when the server never answers its health probe")
        void unhealthy() {
            manager.create("t1", "abc", "g1", null, null);
            cluster.pods.add(new PodState("investigation-t1-abc", "Running", true));
            when(relay.isHealthy(any())).thenReturn(false);

            assertFalse(manager.waitForReady("t1", Duration.ofMillis(100)));
            assertEquals(1, registry.find("warden.sandbox.ready.timeouts").counter().count());
        }

        @Test
        @DisplayName("does not probe health until a pod is ready")
        void podNotReady() {
            cluster.pods.add(new PodState("investigation-t1-abc", "Pending", false));

            assertFalse(manager.waitForReady("t1", Duration.ofMillis(100)));
            verify(relay, never()).isHealthy(any());
        }

        @Test
        @DisplayName("pods that never become ready time out quietly")
        void neverReady() {
            manager.create("t1", "abc", "g1", null, null);
            cluster.pods.add(new PodState("investigation-t1-abc", "Running", false));
            cluster.pods.add(new PodState("investigation-t1-def", "Pending", false));

            var ready = assertDoesNotThrow(() -> manager.waitForReady("t1", Duration.ofMillis(100)));

            assertFalse(ready);
            assertEquals(1, registry.find("warden.sandbox.ready.timeouts").counter().count());
            assertNull(registry.find("warden.sandbox.ready.duration").timer());
        }

        @Test
        @DisplayName("the timeout holds even when the poll interval is longer")
        void timeoutShorterThanPollInterval() {
            properties.setPollInterval(Duration.ofSeconds(30));
            cluster.pods.add(new PodState("investigation-t1-abc", "Pending", false));

            long start = System.nanoTime();
            assertFalse(manager.waitForReady("t1", Duration.ofMillis(200)));

            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
            assertEquals(1, registry.find("warden.sandbox.ready.timeouts").counter().count());
        }

        @Test
        @DisplayName("interrupt ends the wait and keeps the interrupt flag")
        void interrupted() {
            Thread.currentThread().interrupt();
            try {
                assertFalse(manager.waitForReady("t1", Duration.ofSeconds(5)));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("ttl and state")
    class TtlAndState {

        @Test
        @DisplayName("extendTtl moves the shutdown time")
        void extend() {
            manager.create("t1", "abc", "g1", null, null);

            assertTrue(manager.extendTtl("t1", Duration.ofHours(4)));

            assertEquals("2026-03-01T14:00:00Z",
                    cluster.sandbox(NAMESPACE, "investigation-t1").path("spec").path("shutdownTime").asText());
        }

        @Test
        @DisplayName("extendTtl of a missing sandbox is false")
        void extendMissing() {
            assertFalse(manager.extendTtl("t1", Duration.ofHours(1)));
        }

        @Test
        @DisplayName("state follows the sandbox through its lifecycle")
        void states() {
            assertEquals(SandboxState.ABSENT, manager.state("t1"));

            manager.create("t1", "abc", "g1", null, null);
            assertEquals(SandboxState.CREATING, manager.state("t1"));

            cluster.pods.add(new PodState("investigation-t1-abc", "Running", true));
            assertEquals(SandboxState.READY, manager.state("t1"));

            var later = managerAt(Clock.fixed(NOW.plus(Duration.ofHours(3)), ZoneOffset.UTC), generator());
            assertEquals(SandboxState.EXPIRED, later.state("t1"));

            ((ObjectNode) cluster.sandbox(NAMESPACE, "investigation-t1").path("metadata"))
                    .put("deletionTimestamp", "2026-03-01T10:30:00Z");
            assertEquals(SandboxState.TERMINATING, manager.state("t1"));
        }

        @Test
        @DisplayName("cluster failures surface from state")
        void stateFailure() {
            var failing = new FakeClusterClient() {
                @Override
                public JsonNode getSandbox(String namespace, String name) {
                    throw new ClusterException("connection refused");
                }
            };
            var broken = new SandboxManager(failing, new TokenReusePolicy(tokens, Duration.ofMinutes(30)),
                    generator(), new SandboxManifestBuilder(properties, Clock.systemUTC()), relay, catalog,
                    properties, Clock.systemUTC(), null);

            assertThrows(ClusterException.class, () -> broken.state("t1"));
        }
    }
}

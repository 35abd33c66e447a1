package com.warden.sandbox;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.sandbox.k8s.KubernetesApiClient;
import com.warden.sandbox.proxy.ProxyConfig;
import com.warden.sandbox.proxy.ProxyConfigGenerator;
import com.warden.sandbox.proxy.Upstream;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the Kubernetes objects that make up one sandbox: the proxy ConfigMap and the
 * Sandbox custom resource with its agent container and Envoy sidecar.
 *
 * <p>The agent container receives only non-secret context. Its identity token lives in
 * the proxy configuration, which the agent cannot read.
 */
public class SandboxManifestBuilder {

    public static final int AGENT_PORT = 8888;
    public static final String THREAD_ID_LABEL = "thread-id";
    public static final String TENANT_ANNOTATION = "warden.io/tenant-id";
    public static final String TEAM_ANNOTATION = "warden.io/team-id";
    public static final String CONFIG_VOLUME = "envoy-config";
    public static final String CONFIG_MOUNT_PATH = "/etc/envoy";
    public static final String GVISOR_RUNTIME = "gvisor";

    static final int SANDBOX_USER = 1000;
    /** Placeholder so SDKs start up; the proxy replaces the header with the real key. */
    static final String PLACEHOLDER_API_KEY = "sk-ant-REDACTED";

    private static final DateTimeFormatter SHUTDOWN_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private final SandboxProperties properties;
    private final Clock clock;

    public SandboxManifestBuilder(SandboxProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ObjectNode configMap(String namespace, String sandboxName, ProxyConfig config) {
        ObjectNode configMap = nodes.objectNode();
        configMap.put("apiVersion", "v1");
        configMap.put("kind", "ConfigMap");
        ObjectNode metadata = configMap.putObject("metadata");
        metadata.put("name", config.name());
        metadata.put("namespace", namespace);
        metadata.putObject("labels")
                .put("app", "warden")
                .put("component", "envoy-config")
                .put("sandbox", sandboxName);
        configMap.putObject("data").put(ProxyConfig.CONFIG_KEY, config.document());
        return configMap;
    }

    /**
     * @param configuredIntegrations JSON array exposed to the agent as {@code CONFIGURED_INTEGRATIONS}
     * @param ttl                    time until the cluster shuts the sandbox down
     */
    public ObjectNode sandbox(String namespace, String sandboxName, String threadId, String tenantId, String teamId,
                              String configuredIntegrations, String proxyConfigName, Duration ttl,
                              List<Upstream> upstreams) {
        ObjectNode sandbox = nodes.objectNode();
        sandbox.put("apiVersion", KubernetesApiClient.SANDBOX_GROUP + "/" + KubernetesApiClient.SANDBOX_VERSION);
        sandbox.put("kind", "Sandbox");
        ObjectNode metadata = sandbox.putObject("metadata");
        metadata.put("name", sandboxName);
        metadata.put("namespace", namespace);
        metadata.putObject("labels")
                .put("app", "warden")
                .put(THREAD_ID_LABEL, threadId)
                .put("managed-by", "warden");
        metadata.putObject("annotations")
                .put(TENANT_ANNOTATION, tenantId)
                .put(TEAM_ANNOTATION, teamId);

        ObjectNode spec = sandbox.putObject("spec");
        ObjectNode podTemplate = spec.putObject("podTemplate");
        podTemplate.putObject("metadata").putObject("labels")
                .put("app", "warden-sandbox")
                .put(THREAD_ID_LABEL, threadId);

        ObjectNode podSpec = podTemplate.putObject("spec");
        ArrayNode containers = podSpec.putArray("containers");
        containers.add(agentContainer(namespace, sandboxName, threadId, tenantId, teamId,
                configuredIntegrations, upstreams));
        containers.add(proxyContainer());

        podSpec.putArray("volumes").addObject()
                .put("name", CONFIG_VOLUME)
                .putObject("configMap").put("name", proxyConfigName);

        if (properties.isGvisorEnabled()) {
            podSpec.put("runtimeClassName", GVISOR_RUNTIME);
        }

        spec.put("shutdownTime", shutdownTime(ttl));
        spec.put("replicas", 1);
        return sandbox;
    }

    /**
     * Merge patch that moves the sandbox's shutdown time to now + {@code ttl}.
     */
    public ObjectNode shutdownPatch(Duration ttl) {
        ObjectNode patch = nodes.objectNode();
        patch.putObject("spec").put("shutdownTime", shutdownTime(ttl));
        return patch;
    }

    public String shutdownTime(Duration ttl) {
        return SHUTDOWN_FORMAT.format(clock.instant().plus(ttl));
    }

    static String threadSelector(String threadId) {
        return THREAD_ID_LABEL + "=" + threadId;
    }

    private ObjectNode agentContainer(String namespace, String sandboxName, String threadId, String tenantId,
                                      String teamId, String configuredIntegrations, List<Upstream> upstreams) {
        ObjectNode container = nodes.objectNode();
        container.put("name", "agent");
        container.put("image", properties.getImage());
        container.put("imagePullPolicy", pullPolicy(properties.getImage()));
        container.putArray("ports").addObject()
                .put("containerPort", AGENT_PORT)
                .put("name", "sandbox");

        ArrayNode env = container.putArray("env");
        env(env, "WARDEN_TENANT_ID", tenantId);
        env(env, "WARDEN_TEAM_ID", teamId);
        env(env, "THREAD_ID", threadId);
        env(env, "SANDBOX_NAME", sandboxName);
        env(env, "NAMESPACE", namespace);
        env(env, "CONFIGURED_INTEGRATIONS", configuredIntegrations);
        var proxyUrl = "http://localhost:" + ProxyConfigGenerator.LISTENER_PORT;
        for (Upstream upstream : upstreams) {
            env(env, upstream.baseUrlVariable(), proxyUrl);
        }
        env(env, "ANTHROPIC_API_KEY", PLACEHOLDER_API_KEY);

        container.set("resources", resources(properties.getResources().getAgent()));
        ObjectNode securityContext = container.putObject("securityContext");
        securityContext.put("allowPrivilegeEscalation", false);
        securityContext.put("runAsNonRoot", true);
        securityContext.put("runAsUser", SANDBOX_USER);
        securityContext.putObject("capabilities").putArray("drop").add("ALL");
        return container;
    }

    private ObjectNode proxyContainer() {
        ObjectNode container = nodes.objectNode();
        container.put("name", "envoy");
        container.put("image", properties.getProxy().getEnvoyImage());
        container.putArray("args")
                .add("--config-path")
                .add(CONFIG_MOUNT_PATH + "/" + ProxyConfig.CONFIG_KEY)
                .add("--log-level")
                .add("warn");
        container.putArray("ports").addObject()
                .put("containerPort", ProxyConfigGenerator.LISTENER_PORT)
                .put("name", "proxy");
        container.putArray("volumeMounts").addObject()
                .put("name", CONFIG_VOLUME)
                .put("mountPath", CONFIG_MOUNT_PATH)
                .put("readOnly", true);
        container.set("resources", resources(properties.getResources().getProxy()));
        ObjectNode securityContext = container.putObject("securityContext");
        securityContext.put("runAsNonRoot", true);
        securityContext.put("runAsUser", SANDBOX_USER);
        securityContext.put("allowPrivilegeEscalation", false);
        return container;
    }

    private ObjectNode resources(SandboxProperties.ContainerResources limits) {
        ObjectNode resources = nodes.objectNode();
        resources.putObject("requests")
                .put("cpu", limits.getCpuRequest())
                .put("memory", limits.getMemoryRequest());
        resources.putObject("limits")
                .put("cpu", limits.getCpuLimit())
                .put("memory", limits.getMemoryLimit());
        return resources;
    }

    private static void env(ArrayNode env, String name, String value) {
        env.addObject().put("name", name).put("value", value);
    }

    // ECR and GCR images are always re-pulled.
    private static String pullPolicy(String image) {
        return image.contains("ecr") || image.contains("gcr") ? "Always" : "IfNotPresent";
    }
}

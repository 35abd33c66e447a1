package com.warden.sandbox.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.net.URI;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders the per-sandbox Envoy configuration.
 *
 * <p>Every outbound request from the agent passes through an {@code ext_authz} filter that
 * calls the credential resolver with the sandbox's identity token as a static header. The
 * filter never lets a request through when the resolver is unreachable.
 *
 * <p>The document is assembled as a tree and serialized by Jackson, so no input value can
 * alter its structure.
 */
public class ProxyConfigGenerator {

    public static final String IDENTITY_HEADER = "x-sandbox-jwt";
    public static final String ORIGINAL_HOST_HEADER = "x-original-host";
    public static final String EXT_AUTHZ_FILTER = "envoy.filters.http.ext_authz";
    public static final String EXT_AUTHZ_CLUSTER = "ext_authz";
    public static final int LISTENER_PORT = 8001;
    public static final int ADMIN_PORT = 9901;

    static final List<String> ALLOWED_UPSTREAM_HEADERS = List.of("authorization", "x-api-key");

    private static final String HCM_TYPE =
            "type.googleapis.com/envoy.extensions.filters.network.http_connection_manager.v3.HttpConnectionManager";
    private static final String EXT_AUTHZ_TYPE =
            "type.googleapis.com/envoy.extensions.filters.http.ext_authz.v3.ExtAuthz";
    private static final String ROUTER_TYPE =
            "type.googleapis.com/envoy.extensions.filters.http.router.v3.Router";
    private static final String TLS_TYPE =
            "type.googleapis.com/envoy.extensions.transport_sockets.tls.v3.UpstreamTlsContext";

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private final YAMLMapper yaml = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    private final URI resolverUrl;
    private final String resolverHost;
    private final int resolverPort;
    private final Duration authzTimeout;

    /**
     * @param resolverUrl  base URL of the credential resolver, e.g. {@code http://credential-resolver-svc.ns.svc.cluster.local:8002}
     * @param authzTimeout how long Envoy waits for an authorization decision
     */
    public ProxyConfigGenerator(URI resolverUrl, Duration authzTimeout) {
        if (resolverUrl == null || resolverUrl.getHost() == null) {
            throw new IllegalArgumentException("Credential resolver URL must include a host: " + resolverUrl);
        }
        if (authzTimeout == null || authzTimeout.isZero() || authzTimeout.isNegative()) {
            throw new IllegalArgumentException("Authorization timeout must be positive");
        }
        this.resolverUrl = resolverUrl;
        this.resolverHost = resolverUrl.getHost();
        this.resolverPort = resolverUrl.getPort() > 0 ? resolverUrl.getPort()
                : "https".equalsIgnoreCase(resolverUrl.getScheme()) ? 443 : 80;
        this.authzTimeout = authzTimeout;
    }

    public ProxyConfig generate(String sandboxName, String identityToken, List<Upstream> upstreams) {
        validate(sandboxName, identityToken, upstreams);

        ObjectNode root = nodes.objectNode();
        root.putObject("admin").set("address", socketAddress("127.0.0.1", ADMIN_PORT));

        ObjectNode staticResources = root.putObject("static_resources");
        staticResources.putArray("listeners").add(listener(identityToken, upstreams));

        ArrayNode clusters = staticResources.putArray("clusters");
        clusters.add(extAuthzCluster());
        upstreams.forEach(upstream -> clusters.add(upstreamCluster(upstream)));

        try {
            return new ProxyConfig(ProxyConfig.nameFor(sandboxName), yaml.writeValueAsString(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render proxy configuration for " + sandboxName, e);
        }
    }

    private ObjectNode listener(String identityToken, List<Upstream> upstreams) {
        ObjectNode hcm = nodes.objectNode();
        hcm.put("@type", HCM_TYPE);
        hcm.put("stat_prefix", "credential_proxy");
        hcm.put("codec_type", "AUTO");
        hcm.putObject("http_protocol_options").put("allow_absolute_url", true);

        ObjectNode routeConfig = hcm.putObject("route_config");
        routeConfig.put("name", "proxy_routes");
        ArrayNode virtualHosts = routeConfig.putArray("virtual_hosts");

        ObjectNode local = virtualHosts.addObject();
        local.put("name", "localhost_proxy");
        local.putArray("domains")
                .add("localhost:" + LISTENER_PORT)
                .add("127.0.0.1:" + LISTENER_PORT)
                .add("localhost");
        ArrayNode localRoutes = local.putArray("routes");
        upstreams.forEach(upstream -> localRoutes.add(route(upstream.pathPrefix(), upstream.name())));

        for (Upstream upstream : upstreams) {
            ObjectNode host = virtualHosts.addObject();
            host.put("name", upstream.name());
            host.putArray("domains")
                    .add(upstream.host())
                    .add(upstream.host() + ":" + upstream.port());
            host.putArray("routes").add(route("/", upstream.name()));
        }

        ArrayNode httpFilters = hcm.putArray("http_filters");
        httpFilters.add(extAuthzFilter(identityToken));
        ObjectNode router = httpFilters.addObject();
        router.put("name", "envoy.filters.http.router");
        router.putObject("typed_config").put("@type", ROUTER_TYPE);

        ObjectNode filter = nodes.objectNode();
        filter.put("name", "envoy.filters.network.http_connection_manager");
        filter.set("typed_config", hcm);

        ObjectNode listener = nodes.objectNode();
        listener.put("name", "http_proxy");
        listener.set("address", socketAddress("0.0.0.0", LISTENER_PORT));
        listener.putArray("filter_chains").addObject().putArray("filters").add(filter);
        return listener;
    }

    private ObjectNode extAuthzFilter(String identityToken) {
        ObjectNode config = nodes.objectNode();
        config.put("@type", EXT_AUTHZ_TYPE);
        config.put("transport_api_version", "V3");

        ObjectNode httpService = config.putObject("http_service");
        ObjectNode serverUri = httpService.putObject("server_uri");
        serverUri.put("uri", resolverUrl.resolve("/check").toString());
        serverUri.put("cluster", EXT_AUTHZ_CLUSTER);
        serverUri.put("timeout", envoyDuration(authzTimeout));

        ArrayNode headersToAdd = httpService.putObject("authorization_request").putArray("headers_to_add");
        headersToAdd.addObject().put("key", IDENTITY_HEADER).put("value", identityToken);
        headersToAdd.addObject().put("key", ORIGINAL_HOST_HEADER).put("value", "%REQ(:authority)%");

        ArrayNode patterns = httpService.putObject("authorization_response")
                .putObject("allowed_upstream_headers")
                .putArray("patterns");
        ALLOWED_UPSTREAM_HEADERS.forEach(header -> patterns.addObject().put("exact", header));

        config.put("failure_mode_allow", false);
        config.putObject("status_on_error").put("code", 403);

        ObjectNode filter = nodes.objectNode();
        filter.put("name", EXT_AUTHZ_FILTER);
        filter.set("typed_config", config);
        return filter;
    }

    private ObjectNode extAuthzCluster() {
        ObjectNode cluster = nodes.objectNode();
        cluster.put("name", EXT_AUTHZ_CLUSTER);
        cluster.put("type", "STRICT_DNS");
        cluster.put("lb_policy", "ROUND_ROBIN");
        cluster.set("load_assignment", loadAssignment(EXT_AUTHZ_CLUSTER, resolverHost, resolverPort));
        return cluster;
    }

    private ObjectNode upstreamCluster(Upstream upstream) {
        ObjectNode cluster = nodes.objectNode();
        cluster.put("name", upstream.name());
        cluster.put("type", "LOGICAL_DNS");
        cluster.put("dns_lookup_family", "V4_ONLY");
        cluster.put("lb_policy", "ROUND_ROBIN");
        cluster.set("load_assignment", loadAssignment(upstream.name(), upstream.host(), upstream.port()));

        ObjectNode transportSocket = cluster.putObject("transport_socket");
        transportSocket.put("name", "envoy.transport_sockets.tls");
        transportSocket.putObject("typed_config")
                .put("@type", TLS_TYPE)
                .put("sni", upstream.host());
        return cluster;
    }

    private ObjectNode route(String prefix, String cluster) {
        ObjectNode route = nodes.objectNode();
        route.putObject("match").put("prefix", prefix);
        route.putObject("route")
                .put("cluster", cluster)
                .put("auto_host_rewrite", true);
        return route;
    }

    private ObjectNode loadAssignment(String clusterName, String host, int port) {
        ObjectNode assignment = nodes.objectNode();
        assignment.put("cluster_name", clusterName);
        assignment.putArray("endpoints").addObject()
                .putArray("lb_endpoints").addObject()
                .putObject("endpoint")
                .set("address", socketAddress(host, port));
        return assignment;
    }

    private ObjectNode socketAddress(String address, int port) {
        ObjectNode wrapper = nodes.objectNode();
        wrapper.putObject("socket_address")
                .put("address", address)
                .put("port_value", port);
        return wrapper;
    }

    private static String envoyDuration(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : (millis / 1000.0) + "s";
    }

    private static void validate(String sandboxName, String identityToken, List<Upstream> upstreams) {
        if (sandboxName == null || sandboxName.isBlank()) {
            throw new IllegalArgumentException("sandboxName must not be blank");
        }
        if (identityToken == null || identityToken.isBlank()) {
            throw new IllegalArgumentException("identityToken must not be blank");
        }
        if (upstreams == null || upstreams.isEmpty()) {
            throw new IllegalArgumentException("At least one upstream is required");
        }
        Set<String> names = new HashSet<>();
        for (Upstream upstream : upstreams) {
            if (upstream.name() == null || upstream.name().isBlank()
                    || upstream.host() == null || upstream.host().isBlank()) {
                throw new IllegalArgumentException("Upstream requires a name and a host: " + upstream);
            }
            if (EXT_AUTHZ_CLUSTER.equals(upstream.name())) {
                throw new IllegalArgumentException("Upstream name is reserved: " + EXT_AUTHZ_CLUSTER);
            }
            if (!names.add(upstream.name())) {
                throw new IllegalArgumentException("Duplicate upstream name: " + upstream.name());
            }
            if (upstream.pathPrefix() == null || !upstream.pathPrefix().startsWith("/")) {
                throw new IllegalArgumentException(
                        "Upstream %s path prefix must start with '/'".formatted(upstream.name()));
            }
        }
    }
}

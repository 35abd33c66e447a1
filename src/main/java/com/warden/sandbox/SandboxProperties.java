package com.warden.sandbox;

import com.warden.sandbox.proxy.Upstream;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "warden.sandbox")
public class SandboxProperties {

    private String namespace = "default";
    private String image = "warden-agent:latest";
    private Duration ttl = Duration.ofHours(2);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration readyTimeout = Duration.ofSeconds(120);
    private boolean gvisorEnabled = false;

    private Proxy proxy = new Proxy();
    private Router router = new Router();
    private CredentialResolver credentialResolver = new CredentialResolver();
    private Resources resources = new Resources();

    /**
     * Base URL of the credential resolver: the explicit {@code url} if set, otherwise the
     * in-cluster service address in the resolver's namespace.
     */
    public URI resolverUrl() {
        if (credentialResolver.url != null && !credentialResolver.url.isBlank()) {
            return URI.create(credentialResolver.url);
        }
        return URI.create("http://credential-resolver-svc.%s.svc.cluster.local:%d"
                .formatted(credentialResolver.namespace, credentialResolver.port));
    }

    public URI routerUrl() {
        if (router.url != null && !router.url.isBlank()) {
            return URI.create(router.url);
        }
        return URI.create("http://sandbox-router-svc.%s.svc.cluster.local:8080".formatted(namespace));
    }

    public List<Upstream> upstreams() {
        return proxy.upstreams.stream()
                .map(u -> new Upstream(u.getName(), u.getPathPrefix(), u.getHost(), u.getPort()))
                .toList();
    }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getReadyTimeout() { return readyTimeout; }
    public void setReadyTimeout(Duration readyTimeout) { this.readyTimeout = readyTimeout; }
    public boolean isGvisorEnabled() { return gvisorEnabled; }
    public void setGvisorEnabled(boolean gvisorEnabled) { this.gvisorEnabled = gvisorEnabled; }

    public Proxy getProxy() { return proxy; }
    public void setProxy(Proxy proxy) { this.proxy = proxy; }
    public Router getRouter() { return router; }
    public void setRouter(Router router) { this.router = router; }
    public CredentialResolver getCredentialResolver() { return credentialResolver; }
    public void setCredentialResolver(CredentialResolver credentialResolver) { this.credentialResolver = credentialResolver; }
    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }

    public static class Proxy {
        private String envoyImage = "envoyproxy/envoy:v1.28-latest";
        private Duration authzTimeout = Duration.ofSeconds(2);
        private List<UpstreamEntry> upstreams = new ArrayList<>(List.of(
                new UpstreamEntry("anthropic", "/v1/", "api.anthropic.com"),
                new UpstreamEntry("coralogix", "/api/v1/dataprime/", "api.us2.coralogix.com")));

        public String getEnvoyImage() { return envoyImage; }
        public void setEnvoyImage(String envoyImage) { this.envoyImage = envoyImage; }
        public Duration getAuthzTimeout() { return authzTimeout; }
        public void setAuthzTimeout(Duration authzTimeout) { this.authzTimeout = authzTimeout; }
        public List<UpstreamEntry> getUpstreams() { return upstreams; }
        public void setUpstreams(List<UpstreamEntry> upstreams) { this.upstreams = upstreams; }
    }

    public static class UpstreamEntry {
        private String name;
        private String pathPrefix;
        private String host;
        private int port = Upstream.DEFAULT_PORT;

        public UpstreamEntry() {}

        public UpstreamEntry(String name, String pathPrefix, String host) {
            this.name = name;
            this.pathPrefix = pathPrefix;
            this.host = host;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getPathPrefix() { return pathPrefix; }
        public void setPathPrefix(String pathPrefix) { this.pathPrefix = pathPrefix; }
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
    }

    public static class Router {
        /** Empty means the in-cluster router service in the sandbox namespace. */
        private String url = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration healthTimeout = Duration.ofSeconds(5);
        private Duration answerTimeout = Duration.ofSeconds(10);

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getHealthTimeout() { return healthTimeout; }
        public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }
        public Duration getAnswerTimeout() { return answerTimeout; }
        public void setAnswerTimeout(Duration answerTimeout) { this.answerTimeout = answerTimeout; }
    }

    public static class CredentialResolver {
        private String namespace = "warden-prod";
        private int port = 8002;
        /** Overrides the derived in-cluster address, e.g. for a port-forward. */
        private String url = "";
        private Duration catalogTimeout = Duration.ofSeconds(5);

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Duration getCatalogTimeout() { return catalogTimeout; }
        public void setCatalogTimeout(Duration catalogTimeout) { this.catalogTimeout = catalogTimeout; }
    }

    public static class Resources {
        private ContainerResources agent = new ContainerResources("100m", "512Mi", "2000m", "2Gi");
        private ContainerResources proxy = new ContainerResources("50m", "64Mi", "200m", "128Mi");

        public ContainerResources getAgent() { return agent; }
        public void setAgent(ContainerResources agent) { this.agent = agent; }
        public ContainerResources getProxy() { return proxy; }
        public void setProxy(ContainerResources proxy) { this.proxy = proxy; }
    }

    public static class ContainerResources {
        private String cpuRequest;
        private String memoryRequest;
        private String cpuLimit;
        private String memoryLimit;

        public ContainerResources() {}

        public ContainerResources(String cpuRequest, String memoryRequest, String cpuLimit, String memoryLimit) {
            this.cpuRequest = cpuRequest;
            this.memoryRequest = memoryRequest;
            this.cpuLimit = cpuLimit;
            this.memoryLimit = memoryLimit;
        }

        public String getCpuRequest() { return cpuRequest; }
        public void setCpuRequest(String cpuRequest) { this.cpuRequest = cpuRequest; }
        public String getMemoryRequest() { return memoryRequest; }
        public void setMemoryRequest(String memoryRequest) { this.memoryRequest = memoryRequest; }
        public String getCpuLimit() { return cpuLimit; }
        public void setCpuLimit(String cpuLimit) { this.cpuLimit = cpuLimit; }
        public String getMemoryLimit() { return memoryLimit; }
        public void setMemoryLimit(String memoryLimit) { this.memoryLimit = memoryLimit; }
    }
}

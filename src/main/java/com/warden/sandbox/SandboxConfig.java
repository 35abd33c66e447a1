package com.warden.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.metrics.WardenMetrics;
import com.warden.core.security.TokenReusePolicy;
import com.warden.sandbox.k8s.ClusterClient;
import com.warden.sandbox.k8s.KubernetesApiClient;
import com.warden.sandbox.k8s.KubernetesProperties;
import com.warden.sandbox.proxy.ProxyConfigGenerator;
import com.warden.sandbox.relay.ExecutionRelay;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class SandboxConfig {

    @Bean
    public ClusterClient clusterClient(KubernetesProperties properties) {
        return KubernetesApiClient.fromProperties(properties);
    }

    @Bean
    public ProxyConfigGenerator proxyConfigGenerator(SandboxProperties properties) {
        return new ProxyConfigGenerator(properties.resolverUrl(), properties.getProxy().getAuthzTimeout());
    }

    @Bean
    public SandboxManifestBuilder sandboxManifestBuilder(SandboxProperties properties) {
        return new SandboxManifestBuilder(properties, Clock.systemUTC());
    }

    /**
     * Router client. Response bodies are event streams of unbounded length, so only the
     * wait for response headers is bounded.
     */
    @Bean
    public ExecutionRelay executionRelay(SandboxProperties properties, ObjectMapper objectMapper,
                                         @Autowired(required = false) WardenMetrics metrics) {
        var router = properties.getRouter();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(router.getConnectTimeout())
                .build();
        return new ExecutionRelay(properties.routerUrl(), httpClient, objectMapper,
                router.getRequestTimeout(), router.getHealthTimeout(), router.getAnswerTimeout(), metrics);
    }

    @Bean
    public IntegrationCatalogClient integrationCatalogClient(SandboxProperties properties, ObjectMapper objectMapper) {
        var resolver = properties.getCredentialResolver();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(resolver.getCatalogTimeout())
                .build();
        return new IntegrationCatalogClient(properties.resolverUrl(), httpClient, objectMapper,
                resolver.getCatalogTimeout());
    }

    @Bean
    public SandboxManager sandboxManager(ClusterClient clusterClient, TokenReusePolicy tokenReusePolicy,
                                         ProxyConfigGenerator proxyConfigGenerator,
                                         SandboxManifestBuilder sandboxManifestBuilder,
                                         ExecutionRelay executionRelay,
                                         IntegrationCatalogClient integrationCatalogClient,
                                         SandboxProperties properties,
                                         @Autowired(required = false) WardenMetrics metrics) {
        return new SandboxManager(clusterClient, tokenReusePolicy, proxyConfigGenerator, sandboxManifestBuilder,
                executionRelay, integrationCatalogClient, properties, Clock.systemUTC(), metrics);
    }

    @Bean
    public SandboxDispatcher sandboxDispatcher(SandboxManager sandboxManager, ExecutionRelay executionRelay,
                                               SandboxProperties properties) {
        return new SandboxDispatcher(sandboxManager, executionRelay, properties.getTtl(),
                properties.getReadyTimeout());
    }
}

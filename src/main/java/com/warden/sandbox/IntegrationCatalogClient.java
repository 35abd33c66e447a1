package com.warden.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Looks up which integrations a team has configured, so the agent knows what it can use
 * without calling out at runtime.
 *
 * <p>The catalog holds metadata only, never secrets. A failed lookup degrades to an empty
 * list rather than blocking sandbox creation.
 */
public class IntegrationCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(IntegrationCatalogClient.class);

    static final String EMPTY = "[]";

    private final URI resolverUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public IntegrationCatalogClient(URI resolverUrl, HttpClient httpClient, ObjectMapper objectMapper,
                                    Duration timeout) {
        this.resolverUrl = resolverUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * @return the configured integrations as a JSON array string, {@code "[]"} if unavailable
     */
    public String fetchConfiguredIntegrations(String identityToken, String tenantId, String teamId) {
        var request = HttpRequest.newBuilder()
                .uri(resolverUrl.resolve("/api/integrations"))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("X-Sandbox-JWT", identityToken)
                .header("X-Tenant-Id", tenantId)
                .header("X-Team-Id", teamId)
                .GET()
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Integration catalog returned HTTP {} for tenant {} team {}",
                        response.statusCode(), tenantId, teamId);
                return EMPTY;
            }
            var integrations = objectMapper.readTree(response.body()).path("integrations");
            return integrations.isArray() ? objectMapper.writeValueAsString(integrations) : EMPTY;
        } catch (IOException e) {
            log.warn("Failed to fetch configured integrations for tenant {} team {}: {}",
                    tenantId, teamId, e.toString());
            return EMPTY;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching configured integrations for tenant {} team {}", tenantId, teamId);
            return EMPTY;
        }
    }
}

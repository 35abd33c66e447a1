package com.warden.sandbox.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.Optional;

/**
 * Read-only view over a rendered proxy document, used to refuse documents that would let
 * traffic through without an authorization decision.
 */
public final class ProxyConfigInspector {

    private static final YAMLMapper YAML = new YAMLMapper();

    private final JsonNode extAuthz;

    private ProxyConfigInspector(JsonNode extAuthz) {
        this.extAuthz = extAuthz;
    }

    /**
     * @throws IllegalArgumentException if the document is not valid YAML
     */
    public static ProxyConfigInspector of(String document) {
        JsonNode root;
        try {
            root = YAML.readTree(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Proxy configuration is not valid YAML", e);
        }
        return new ProxyConfigInspector(findExtAuthz(root));
    }

    /**
     * True when the authorization filter is missing or does not explicitly deny on resolver failure.
     */
    public boolean forwardsOnAuthorizationFailure() {
        if (extAuthz == null) {
            return true;
        }
        JsonNode failureModeAllow = extAuthz.path("failure_mode_allow");
        return !(failureModeAllow.isBoolean() && !failureModeAllow.booleanValue());
    }

    /**
     * Value of the static identity header the filter adds to authorization requests.
     */
    public Optional<String> identityHeader() {
        if (extAuthz == null) {
            return Optional.empty();
        }
        for (JsonNode header : extAuthz.path("http_service").path("authorization_request").path("headers_to_add")) {
            if (ProxyConfigGenerator.IDENTITY_HEADER.equals(header.path("key").asText())) {
                return Optional.of(header.path("value").asText());
            }
        }
        return Optional.empty();
    }

    private static JsonNode findExtAuthz(JsonNode root) {
        if (root == null) {
            return null;
        }
        for (JsonNode listener : root.path("static_resources").path("listeners")) {
            for (JsonNode chain : listener.path("filter_chains")) {
                for (JsonNode filter : chain.path("filters")) {
                    for (JsonNode httpFilter : filter.path("typed_config").path("http_filters")) {
                        if (ProxyConfigGenerator.EXT_AUTHZ_FILTER.equals(httpFilter.path("name").asText())) {
                            return httpFilter.path("typed_config");
                        }
                    }
                }
            }
        }
        return null;
    }
}

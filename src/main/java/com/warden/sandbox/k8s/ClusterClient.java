package com.warden.sandbox.k8s;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The cluster operations the sandbox lifecycle needs.
 *
 * <p>Error statuses surface as {@link ClusterApiException} so callers can interpret
 * 404 and 409 themselves. Timeouts surface as {@link ClusterTimeoutException}.
 */
public interface ClusterClient {

    JsonNode createConfigMap(String namespace, ObjectNode configMap);

    /** Unconditional replace of an existing ConfigMap. */
    JsonNode replaceConfigMap(String namespace, String name, ObjectNode configMap);

    void deleteConfigMap(String namespace, String name);

    JsonNode createSandbox(String namespace, ObjectNode sandbox);

    JsonNode getSandbox(String namespace, String name);

    /** Applies a JSON merge patch to a Sandbox resource. */
    JsonNode patchSandbox(String namespace, String name, ObjectNode mergePatch);

    void deleteSandbox(String namespace, String name);

    List<PodState> listPods(String namespace, String labelSelector);
}

package com.warden.sandbox.k8s;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parts of a pod's status that readiness decisions depend on.
 */
public record PodState(String name, String phase, boolean ready) {

    public static PodState fromJson(JsonNode pod) {
        var ready = false;
        for (JsonNode condition : pod.path("status").path("conditions")) {
            if ("Ready".equals(condition.path("type").asText())) {
                ready = "True".equals(condition.path("status").asText());
            }
        }
        return new PodState(
                pod.path("metadata").path("name").asText(null),
                pod.path("status").path("phase").asText(null),
                ready);
    }

    public boolean isRunningAndReady() {
        return "Running".equals(phase) && ready;
    }
}

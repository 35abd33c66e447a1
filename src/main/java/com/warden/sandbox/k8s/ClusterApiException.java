package com.warden.sandbox.k8s;

/**
 * The cluster API answered with an error status.
 */
public class ClusterApiException extends ClusterException {

    private final int statusCode;
    private final String operation;
    private final String resource;

    public ClusterApiException(int statusCode, String operation, String resource, String body) {
        super("Cluster API %s %s failed (HTTP %d): %s".formatted(operation, resource, statusCode, body));
        this.statusCode = statusCode;
        this.operation = operation;
        this.resource = resource;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public String getResource() {
        return resource;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }
}

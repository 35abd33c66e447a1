package com.warden.sandbox.k8s;

/**
 * A cluster API call failed before a response was received.
 */
public class ClusterException extends RuntimeException {

    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}

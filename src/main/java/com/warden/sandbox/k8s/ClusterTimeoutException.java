package com.warden.sandbox.k8s;

/**
 * A cluster API call did not complete within the configured request timeout.
 */
public class ClusterTimeoutException extends ClusterException {

    public ClusterTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

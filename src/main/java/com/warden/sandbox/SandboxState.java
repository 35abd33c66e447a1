package com.warden.sandbox;

/**
 * Observable lifecycle state of a sandbox, derived from its custom resource and pods.
 */
public enum SandboxState {
    /** No custom resource exists. */
    ABSENT,
    /** The resource exists but no pod is running and ready yet. */
    CREATING,
    READY,
    /** The resource is being deleted. */
    TERMINATING,
    /** The resource's shutdown time has passed; the cluster will remove it. */
    EXPIRED
}

package com.warden.sandbox;

/**
 * A thread's sandbox exists but was provisioned for a different tenant or team.
 */
public class SandboxOwnershipException extends RuntimeException {

    private final String threadId;

    public SandboxOwnershipException(String threadId) {
        super("Sandbox for thread " + threadId + " belongs to another tenant or team");
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}

package com.warden.sandbox.relay;

/**
 * A request relayed to a sandbox failed.
 */
public abstract class SandboxRelayException extends RuntimeException {

    private final String sandboxName;
    private final String threadId;
    private final RelayFailure failure;
    private final int statusCode;

    protected SandboxRelayException(String message, String sandboxName, String threadId,
                                    RelayFailure failure, int statusCode, Throwable cause) {
        super(message, cause);
        this.sandboxName = sandboxName;
        this.threadId = threadId;
        this.failure = failure;
        this.statusCode = statusCode;
    }

    public String getSandboxName() {
        return sandboxName;
    }

    public String getThreadId() {
        return threadId;
    }

    public RelayFailure getFailure() {
        return failure;
    }

    /** HTTP status returned by the router, or {@code -1} when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}

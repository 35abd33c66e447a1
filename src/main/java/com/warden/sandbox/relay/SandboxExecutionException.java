package com.warden.sandbox.relay;

public class SandboxExecutionException extends SandboxRelayException {

    public SandboxExecutionException(String message, String sandboxName, String threadId,
                                     RelayFailure failure, int statusCode, Throwable cause) {
        super(message, sandboxName, threadId, failure, statusCode, cause);
    }
}

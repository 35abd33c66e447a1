package com.warden.sandbox.relay;

public class SandboxInterruptException extends SandboxRelayException {

    public SandboxInterruptException(String message, String sandboxName, String threadId,
                                     RelayFailure failure, int statusCode, Throwable cause) {
        super(message, sandboxName, threadId, failure, statusCode, cause);
    }
}

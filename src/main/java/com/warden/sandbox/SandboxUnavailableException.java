package com.warden.sandbox;

/**
 * A sandbox could not be brought to a ready state in time.
 */
public class SandboxUnavailableException extends RuntimeException {

    public static final String USER_MESSAGE = "Sandbox environment not available, try again";

    private final String threadId;

    public SandboxUnavailableException(String threadId) {
        super(USER_MESSAGE);
        this.threadId = threadId;
    }

    public String getThreadId() {
        return threadId;
    }
}

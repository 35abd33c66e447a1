package com.warden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String THREAD_ID = "threadId";
    public static final String SANDBOX_NAME = "sandboxName";

    private MdcContext() {}

    public static void setSandbox(String threadId, String sandboxName) {
        MDC.put(THREAD_ID, threadId);
        MDC.put(SANDBOX_NAME, sandboxName);
    }

    public static void clear() {
        MDC.remove(THREAD_ID);
        MDC.remove(SANDBOX_NAME);
    }
}

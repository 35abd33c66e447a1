package com.warden.sandbox;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * A sandbox as known to the lifecycle manager.
 *
 * <p>{@code identityToken} is kept only in memory and must never be serialized to clients
 * or logs. It may be {@code null} for sandboxes this process did not create.
 */
public record SandboxRecord(String name, String threadId, String namespace, Instant createdAt, String identityToken) {

    public static final String NAME_PREFIX = "investigation-";

    /** Longest thread id whose sandbox name still fits a 63-character DNS label. */
    public static final int MAX_THREAD_ID_LENGTH = 63 - NAME_PREFIX.length();

    // DNS-1123 label characters; also a valid label value, so it is safe in selectors.
    private static final Pattern THREAD_ID = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");

    /**
     * @throws IllegalArgumentException if the thread id cannot name a cluster object
     */
    public static String nameFor(String threadId) {
        return NAME_PREFIX + requireValidThreadId(threadId);
    }

    /**
     * Thread ids become part of resource names, API paths and label selectors, so they are
     * restricted to lowercase alphanumerics and inner dashes.
     *
     * @throws IllegalArgumentException if the thread id is blank, too long or has other characters
     */
    public static String requireValidThreadId(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId must not be blank");
        }
        if (threadId.length() > MAX_THREAD_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "threadId must be at most %d characters".formatted(MAX_THREAD_ID_LENGTH));
        }
        if (!THREAD_ID.matcher(threadId).matches()) {
            throw new IllegalArgumentException(
                    "threadId must consist of lowercase letters, digits and '-', starting and ending alphanumeric");
        }
        return threadId;
    }

    @Override
    public String toString() {
        return "SandboxRecord[name=%s, threadId=%s, namespace=%s, createdAt=%s]"
                .formatted(name, threadId, namespace, createdAt);
    }
}

package com.warden.sandbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.core.logging.MdcContext;
import com.warden.sandbox.relay.Attachment;
import com.warden.sandbox.relay.ExecutionRelay;
import com.warden.sandbox.relay.SandboxEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Routes a prompt for a thread to that thread's sandbox, creating the sandbox on first use.
 */
public class SandboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SandboxDispatcher.class);

    private final SandboxManager sandboxManager;
    private final ExecutionRelay relay;
    private final Duration ttl;
    private final Duration readyTimeout;

    public SandboxDispatcher(SandboxManager sandboxManager, ExecutionRelay relay, Duration ttl, Duration readyTimeout) {
        this.sandboxManager = sandboxManager;
        this.relay = relay;
        this.ttl = ttl;
        this.readyTimeout = readyTimeout;
    }

    /**
     * Runs a prompt in the thread's sandbox. An existing sandbox gets its lifetime extended;
     * otherwise a new one is created and awaited.
     *
     * @throws SandboxUnavailableException if a new sandbox does not become ready in time
     * @throws SandboxOwnershipException   if the thread's sandbox was provisioned for another tenant or team
     */
    public SandboxEventStream dispatch(String threadId, String tenantId, String teamId,
                                       String prompt, List<Attachment> attachments) {
        var sandbox = sandboxManager.get(threadId);
        if (sandbox != null) {
            if (!sandboxManager.isOwnedBy(sandbox, tenantId, teamId)) {
                log.warn("Refusing prompt for thread {}: sandbox {} belongs to another tenant or team",
                        threadId, sandbox.name());
                throw new SandboxOwnershipException(threadId);
            }
            log.info("Reusing sandbox {} for thread {}", sandbox.name(), threadId);
            sandboxManager.extendTtl(threadId, ttl);
        } else {
            sandbox = sandboxManager.create(threadId, tenantId, teamId, ttl, null);
            if (!sandboxManager.waitForReady(threadId, readyTimeout)) {
                log.warn("Sandbox {} did not become ready within {}s", sandbox.name(), readyTimeout.toSeconds());
                throw new SandboxUnavailableException(threadId);
            }
        }
        MdcContext.setSandbox(threadId, sandbox.name());
        try {
            return relay.execute(sandbox, prompt, attachments);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Forwards the user's answers to a question the sandbox is waiting on.
     */
    public JsonNode answer(SandboxRecord sandbox, JsonNode answers) {
        MdcContext.setSandbox(sandbox.threadId(), sandbox.name());
        try {
            return relay.answer(sandbox, answers);
        } finally {
            MdcContext.clear();
        }
    }

    public SandboxEventStream interrupt(SandboxRecord sandbox) {
        MdcContext.setSandbox(sandbox.threadId(), sandbox.name());
        try {
            return relay.interrupt(sandbox);
        } finally {
            MdcContext.clear();
        }
    }
}

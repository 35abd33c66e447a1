package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxDispatcher;
import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.relay.SandboxEvent;
import com.warden.sandbox.relay.SandboxRelayException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: warden interrupt &lt;thread-id&gt;
 */
@Command(name = "interrupt", mixinStandardHelpOptions = true, description = "Stop the task running in a sandbox")
@Component
public class InterruptCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    private final SandboxManager sandboxManager;
    private final SandboxDispatcher dispatcher;

    public InterruptCommand(SandboxManager sandboxManager, SandboxDispatcher dispatcher) {
        this.sandboxManager = sandboxManager;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        try {
            var record = sandboxManager.get(threadId);
            if (record == null) {
                ConsoleOutput.error("No sandbox for thread " + threadId);
                return;
            }
            try (var events = dispatcher.interrupt(record)) {
                for (SandboxEvent event : events) {
                    ConsoleOutput.event(event);
                }
            }
        } catch (SandboxRelayException e) {
            ConsoleOutput.error("Interrupt failed (" + e.getFailure() + "): " + e.getMessage());
        } catch (ClusterException e) {
            ConsoleOutput.error("Sandbox lookup failed: " + e.getMessage());
        }
    }
}

package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.SandboxState;
import com.warden.sandbox.k8s.ClusterException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: warden status &lt;thread-id&gt;
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a thread's sandbox")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    private final SandboxManager sandboxManager;

    public StatusCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            var record = sandboxManager.get(threadId);
            if (record == null) {
                ConsoleOutput.error("No sandbox for thread " + threadId);
                return;
            }
            System.out.println("SANDBOX " + record.name());
            System.out.println("Namespace: " + record.namespace());
            System.out.println("Created:   " + record.createdAt());

            var state = sandboxManager.state(threadId);
            if (state == SandboxState.READY) {
                ConsoleOutput.success("State: " + state);
            } else if (state == SandboxState.EXPIRED || state == SandboxState.TERMINATING) {
                ConsoleOutput.error("State: " + state);
            } else {
                ConsoleOutput.info("State: " + state);
            }
        } catch (ClusterException e) {
            ConsoleOutput.error("Status lookup failed: " + e.getMessage());
        }
    }
}

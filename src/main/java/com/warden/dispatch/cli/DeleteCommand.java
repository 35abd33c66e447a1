package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.k8s.ClusterException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: warden delete &lt;thread-id&gt;
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Tear down a thread's sandbox")
@Component
public class DeleteCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    private final SandboxManager sandboxManager;

    public DeleteCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        try {
            sandboxManager.delete(threadId);
            ConsoleOutput.success("Deleted sandbox for thread " + threadId);
        } catch (ClusterException e) {
            ConsoleOutput.error("Delete failed: " + e.getMessage());
        }
    }
}

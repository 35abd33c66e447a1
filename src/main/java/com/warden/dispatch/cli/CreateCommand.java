package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.k8s.ClusterException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;

/**
 * CLI command: warden create &lt;thread-id&gt; --tenant T --team G
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create the sandbox for a thread")
@Component
public class CreateCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    @Option(names = "--tenant", required = true, description = "Tenant ID")
    private String tenantId;

    @Option(names = "--team", required = true, description = "Team ID")
    private String teamId;

    @Option(names = "--ttl-minutes", description = "Sandbox lifetime in minutes (default: configured TTL)")
    private Integer ttlMinutes;

    @Option(names = {"--wait", "-w"}, description = "Wait until the sandbox is ready")
    private boolean waitForReady;

    @Option(names = "--timeout", description = "Readiness timeout in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private int timeoutSeconds;

    private final SandboxManager sandboxManager;

    public CreateCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var ttl = ttlMinutes != null ? Duration.ofMinutes(ttlMinutes) : null;
        try {
            var record = sandboxManager.create(threadId, tenantId, teamId, ttl, null);
            ConsoleOutput.success("Sandbox " + record.name() + " in namespace " + record.namespace());
            if (waitForReady) {
                ConsoleOutput.info("Waiting up to " + timeoutSeconds + "s for readiness...");
                if (sandboxManager.waitForReady(threadId, Duration.ofSeconds(timeoutSeconds))) {
                    ConsoleOutput.success("Sandbox ready");
                } else {
                    ConsoleOutput.error("Sandbox not ready after " + timeoutSeconds + "s");
                }
            }
        } catch (ClusterException e) {
            ConsoleOutput.error("Create failed: " + e.getMessage());
        }
    }
}

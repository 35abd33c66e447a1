package com.warden.dispatch.cli;

import com.warden.sandbox.SandboxDispatcher;
import com.warden.sandbox.SandboxOwnershipException;
import com.warden.sandbox.SandboxUnavailableException;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.relay.Attachment;
import com.warden.sandbox.relay.SandboxEvent;
import com.warden.sandbox.relay.SandboxRelayException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * CLI command: warden exec &lt;thread-id&gt; --tenant T --team G "prompt"
 * <p>
 * Creates the sandbox if needed and prints the streamed events as they arrive.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Run a prompt in a thread's sandbox")
@Component
public class ExecCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    @Parameters(index = "1", description = "Prompt to run")
    private String prompt;

    @Option(names = "--tenant", required = true, description = "Tenant ID")
    private String tenantId;

    @Option(names = "--team", required = true, description = "Team ID")
    private String teamId;

    @Option(names = {"--attach", "-a"}, description = "File to send along with the prompt (repeatable)")
    private List<Path> attachments = new ArrayList<>();

    private final SandboxDispatcher dispatcher;

    public ExecCommand(SandboxDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        ConsoleOutput.sandbox("Dispatching to thread " + threadId);
        try (var events = dispatcher.dispatch(threadId, tenantId, teamId, prompt, readAttachments())) {
            for (SandboxEvent event : events) {
                ConsoleOutput.event(event);
            }
        } catch (SandboxUnavailableException | SandboxOwnershipException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (SandboxRelayException e) {
            ConsoleOutput.error("Execution failed (" + e.getFailure() + "): " + e.getMessage());
        } catch (ClusterException e) {
            ConsoleOutput.error("Sandbox setup failed: " + e.getMessage());
        }
    }

    private List<Attachment> readAttachments() {
        var result = new ArrayList<Attachment>();
        for (Path path : attachments) {
            try {
                var mediaType = Files.probeContentType(path);
                var data = Base64.getEncoder().encodeToString(Files.readAllBytes(path));
                result.add(Attachment.base64(mediaType != null ? mediaType : "application/octet-stream",
                        data, path.getFileName().toString()));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read attachment " + path, e);
            }
        }
        return result;
    }
}

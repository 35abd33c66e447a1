package com.warden.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.sandbox.SandboxDispatcher;
import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.relay.SandboxRelayException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: warden answer &lt;thread-id&gt; '{"question": "answer"}'
 */
@Command(name = "answer", mixinStandardHelpOptions = true,
        description = "Answer a question the agent in a sandbox is waiting on")
@Component
public class AnswerCommand implements Runnable {

    @Parameters(index = "0", description = "Thread ID")
    private String threadId;

    @Parameters(index = "1", description = "Answers as a JSON object")
    private String answersJson;

    private final SandboxManager sandboxManager;
    private final SandboxDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public AnswerCommand(SandboxManager sandboxManager, SandboxDispatcher dispatcher, ObjectMapper objectMapper) {
        this.sandboxManager = sandboxManager;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try {
            var answers = objectMapper.readTree(answersJson);
            if (!answers.isObject()) {
                ConsoleOutput.error("Answers must be a JSON object");
                return;
            }
            var record = sandboxManager.get(threadId);
            if (record == null) {
                ConsoleOutput.error("No sandbox for thread " + threadId);
                return;
            }
            var acknowledgement = dispatcher.answer(record, answers);
            ConsoleOutput.success("Answer delivered to " + record.name() + " " + acknowledgement);
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Answers are not valid JSON: " + e.getOriginalMessage());
        } catch (SandboxRelayException e) {
            ConsoleOutput.error("Answer failed (" + e.getFailure() + "): " + e.getMessage());
        } catch (ClusterException e) {
            ConsoleOutput.error("Sandbox lookup failed: " + e.getMessage());
        }
    }
}

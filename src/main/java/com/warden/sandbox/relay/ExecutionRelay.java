package com.warden.sandbox.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.core.metrics.WardenMetrics;
import com.warden.sandbox.SandboxManifestBuilder;
import com.warden.sandbox.SandboxRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Talks to a sandbox's internal server through the sandbox router.
 *
 * <p>Sandboxes are not addressable directly. Every request goes to the router, which
 * forwards it based on the {@code X-Sandbox-*} headers and streams the response back.
 */
public class ExecutionRelay {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRelay.class);

    public static final String SANDBOX_ID_HEADER = "X-Sandbox-ID";
    public static final String SANDBOX_PORT_HEADER = "X-Sandbox-Port";
    public static final String SANDBOX_NAMESPACE_HEADER = "X-Sandbox-Namespace";

    private static final int ERROR_BODY_LINES = 5;

    private final URI routerUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Duration healthTimeout;
    private final Duration answerTimeout;
    private final WardenMetrics metrics;

    /**
     * @param requestTimeout how long to wait for response headers on execute and interrupt
     * @param healthTimeout  how long a health probe may take in total
     * @param answerTimeout  how long delivering an answer may take in total
     * @param metrics        may be {@code null}
     */
    public ExecutionRelay(URI routerUrl, HttpClient httpClient, ObjectMapper objectMapper,
                          Duration requestTimeout, Duration healthTimeout, Duration answerTimeout,
                          WardenMetrics metrics) {
        this.routerUrl = routerUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.healthTimeout = healthTimeout;
        this.answerTimeout = answerTimeout;
        this.metrics = metrics;
    }

    /**
     * Starts a task in the sandbox and returns its event stream.
     *
     * @param attachments may be {@code null} or empty
     * @throws SandboxExecutionException if the router could not be reached, timed out or rejected the request
     */
    public SandboxEventStream execute(SandboxRecord sandbox, String prompt, List<Attachment> attachments) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", prompt);
        body.put("thread_id", sandbox.threadId());
        if (attachments != null && !attachments.isEmpty()) {
            body.set("images", objectMapper.valueToTree(attachments));
        }
        log.info("Executing in sandbox {} (thread {})", sandbox.name(), sandbox.threadId());
        return post("/execute", "execute", sandbox, body,
                (message, failure, status, cause) -> new SandboxExecutionException(
                        message, sandbox.name(), sandbox.threadId(), failure, status, cause));
    }

    /**
     * Asks the sandbox to stop its current task. Cancellation is advisory: a concurrent
     * execute stream typically ends with a cancelled result event.
     *
     * @throws SandboxInterruptException if the router could not be reached, timed out or rejected the request
     */
    public SandboxEventStream interrupt(SandboxRecord sandbox) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("thread_id", sandbox.threadId());
        log.info("Interrupting sandbox {} (thread {})", sandbox.name(), sandbox.threadId());
        return post("/interrupt", "interrupt", sandbox, body,
                (message, failure, status, cause) -> new SandboxInterruptException(
                        message, sandbox.name(), sandbox.threadId(), failure, status, cause));
    }

    /**
     * Delivers the user's answers to a question the agent asked through a {@code question}
     * event. The agent's paused task resumes on the open execute stream.
     *
     * @param answers answers keyed by question, passed through unchanged
     * @return the sandbox's acknowledgement
     * @throws SandboxExecutionException if the router could not be reached, timed out or rejected the answers
     */
    public JsonNode answer(SandboxRecord sandbox, JsonNode answers) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("thread_id", sandbox.threadId());
        body.set("answers", answers);
        FailureFactory failures = (message, failure, status, cause) -> new SandboxExecutionException(
                message, sandbox.name(), sandbox.threadId(), failure, status, cause);
        var request = requestBuilder("/answer", sandbox)
                .timeout(answerTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        log.info("Answering question in sandbox {} (thread {})", sandbox.name(), sandbox.threadId());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw failure("answer", failures, "answer timed out after %ss for sandbox %s"
                    .formatted(answerTimeout.toSeconds(), sandbox.name()), RelayFailure.TIMEOUT, -1, e);
        } catch (IOException e) {
            throw failure("answer", failures, "Could not reach sandbox %s for answer: %s"
                    .formatted(sandbox.name(), e.getMessage()), RelayFailure.UNREACHABLE, -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("answer", failures, "Interrupted while calling sandbox %s for answer"
                    .formatted(sandbox.name()), RelayFailure.UNREACHABLE, -1, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw failure("answer", failures, "Sandbox %s rejected answer (HTTP %d): %s"
                    .formatted(sandbox.name(), status, response.body()), RelayFailure.REJECTED, status, null);
        }
        var acknowledgement = response.body();
        if (acknowledgement == null || acknowledgement.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(acknowledgement);
        } catch (IOException e) {
            throw failure("answer", failures, "Sandbox %s sent a malformed answer acknowledgement"
                    .formatted(sandbox.name()), RelayFailure.REJECTED, status, e);
        }
    }

    /**
     * True if the sandbox's server answers its health endpoint with 200.
     */
    public boolean isHealthy(SandboxRecord sandbox) {
        var request = requestBuilder("/health", sandbox)
                .timeout(healthTimeout)
                .GET()
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Health probe for sandbox {} failed: {}", sandbox.name(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private SandboxEventStream post(String path, String operation, SandboxRecord sandbox, ObjectNode body,
                                    FailureFactory failures) {
        var request = requestBuilder(path, sandbox)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();

        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (HttpTimeoutException e) {
            throw failure(operation, failures, "%s timed out after %ss for sandbox %s"
                    .formatted(operation, requestTimeout.toSeconds(), sandbox.name()), RelayFailure.TIMEOUT, -1, e);
        } catch (IOException e) {
            throw failure(operation, failures, "Could not reach sandbox %s for %s: %s"
                    .formatted(sandbox.name(), operation, e.getMessage()), RelayFailure.UNREACHABLE, -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(operation, failures, "Interrupted while calling sandbox %s for %s"
                    .formatted(sandbox.name(), operation), RelayFailure.UNREACHABLE, -1, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String detail;
            try (var lines = response.body()) {
                detail = lines.limit(ERROR_BODY_LINES).collect(Collectors.joining(" "));
            }
            throw failure(operation, failures, "Sandbox %s rejected %s (HTTP %d): %s"
                    .formatted(sandbox.name(), operation, status, detail), RelayFailure.REJECTED, status, null);
        }
        return new SandboxEventStream(response.body(), objectMapper);
    }

    private SandboxRelayException failure(String operation, FailureFactory failures, String message,
                                          RelayFailure kind, int status, Throwable cause) {
        log.warn(message);
        if (metrics != null) {
            metrics.recordRelayFailure(operation, kind.name().toLowerCase());
        }
        return failures.create(message, kind, status, cause);
    }

    private HttpRequest.Builder requestBuilder(String path, SandboxRecord sandbox) {
        return HttpRequest.newBuilder()
                .uri(routerUrl.resolve(path))
                .header(SANDBOX_ID_HEADER, sandbox.name())
                .header(SANDBOX_PORT_HEADER, String.valueOf(SandboxManifestBuilder.AGENT_PORT))
                .header(SANDBOX_NAMESPACE_HEADER, sandbox.namespace());
    }

    @FunctionalInterface
    private interface FailureFactory {
        SandboxRelayException create(String message, RelayFailure failure, int statusCode, Throwable cause);
    }
}

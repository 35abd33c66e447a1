package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.sandbox.SandboxDispatcher;
import com.warden.sandbox.SandboxManager;
import com.warden.sandbox.SandboxOwnershipException;
import com.warden.sandbox.SandboxUnavailableException;
import com.warden.sandbox.k8s.ClusterException;
import com.warden.sandbox.relay.RelayFailure;
import com.warden.sandbox.relay.SandboxRelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Map;

/**
 * REST controller for sandbox lifecycle and execution.
 */
@RestController
@RequestMapping("/api/v1/sandboxes")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxManager sandboxManager;
    private final SandboxDispatcher dispatcher;
    private final SandboxEventStreamer streamer;

    public SandboxController(SandboxManager sandboxManager, SandboxDispatcher dispatcher,
                             SandboxEventStreamer streamer) {
        this.sandboxManager = sandboxManager;
        this.dispatcher = dispatcher;
        this.streamer = streamer;
    }

    /**
     * POST /api/v1/sandboxes: Create (or adopt) the sandbox for a thread.
     */
    @PostMapping
    public ResponseEntity<SandboxResponse> createSandbox(@RequestBody CreateSandboxRequest request) {
        if (isBlank(request.threadId()) || isBlank(request.tenantId()) || isBlank(request.teamId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "thread_id, tenant_id and team_id are required");
        }
        if (request.ttlMinutes() != null && request.ttlMinutes() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "ttl_minutes must be positive");
        }
        var ttl = request.ttlMinutes() != null ? Duration.ofMinutes(request.ttlMinutes()) : null;
        var record = sandboxManager.create(request.threadId(), request.tenantId(), request.teamId(), ttl, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(SandboxResponse.of(record, null));
    }

    /**
     * GET /api/v1/sandboxes/{threadId}: Sandbox details including its lifecycle state.
     */
    @GetMapping("/{threadId}")
    public ResponseEntity<SandboxResponse> getSandbox(@PathVariable String threadId) {
        var record = sandboxManager.get(threadId);
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(SandboxResponse.of(record, sandboxManager.state(threadId)));
    }

    /**
     * DELETE /api/v1/sandboxes/{threadId}: Tear down a sandbox. Idempotent.
     */
    @DeleteMapping("/{threadId}")
    public ResponseEntity<Void> deleteSandbox(@PathVariable String threadId) {
        sandboxManager.delete(threadId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/sandboxes/{threadId}/execute: Run a prompt, streaming sandbox events as SSE.
     * Creates the sandbox first if the thread has none.
     */
    @PostMapping("/{threadId}/execute")
    public ResponseEntity<SseEmitter> execute(@PathVariable String threadId, @RequestBody ExecuteRequest request) {
        if (isBlank(request.prompt()) || isBlank(request.tenantId()) || isBlank(request.teamId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "prompt, tenant_id and team_id are required");
        }
        var events = dispatcher.dispatch(threadId, request.tenantId(), request.teamId(),
                request.prompt(), request.images());
        return ResponseEntity.ok(streamer.stream(threadId, events));
    }

    /**
     * POST /api/v1/sandboxes/{threadId}/interrupt: Stop the running task, streaming the acknowledgement.
     */
    @PostMapping("/{threadId}/interrupt")
    public ResponseEntity<SseEmitter> interrupt(@PathVariable String threadId) {
        var record = sandboxManager.get(threadId);
        if (record == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No sandbox for thread " + threadId);
        }
        return ResponseEntity.ok(streamer.stream(threadId, dispatcher.interrupt(record)));
    }

    /**
     * POST /api/v1/sandboxes/{threadId}/answer: Answer a question the sandbox's agent is waiting on.
     */
    @PostMapping("/{threadId}/answer")
    public ResponseEntity<JsonNode> answer(@PathVariable String threadId, @RequestBody AnswerRequest request) {
        if (request.answers() == null || !request.answers().isObject()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "answers must be a JSON object");
        }
        var record = sandboxManager.get(threadId);
        if (record == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No sandbox for thread " + threadId);
        }
        return ResponseEntity.ok(dispatcher.answer(record, request.answers()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException e) {
        return error(e.getStatusCode(), e.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> handleInvalid(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(SandboxOwnershipException.class)
    ResponseEntity<Map<String, String>> handleOwnership(SandboxOwnershipException e) {
        return error(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(SandboxUnavailableException.class)
    ResponseEntity<Map<String, String>> handleUnavailable(SandboxUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(SandboxRelayException.class)
    ResponseEntity<Map<String, String>> handleRelay(SandboxRelayException e) {
        var status = e.getFailure() == RelayFailure.TIMEOUT ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return error(status, e.getMessage());
    }

    @ExceptionHandler(ClusterException.class)
    ResponseEntity<Map<String, String>> handleCluster(ClusterException e) {
        log.error("Cluster operation failed", e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    // Content type is fixed so clients that asked for text/event-stream still get the error body.
    private static ResponseEntity<Map<String, String>> error(HttpStatusCode status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message != null ? message : "HTTP " + status.value()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.warden.dispatch.api;

import com.warden.sandbox.relay.SandboxEvent;
import com.warden.sandbox.relay.SandboxEventStream;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pumps a sandbox's event stream into an {@link SseEmitter} on a background thread,
 * forwarding each event as an SSE data frame as soon as it arrives.
 */
@Service
public class SandboxEventStreamer {

    private static final Logger log = LoggerFactory.getLogger(SandboxEventStreamer.class);

    /** Long enough for a full agent run. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

    private final long timeoutMs;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-relay-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SandboxEventStreamer() {
        this(DEFAULT_TIMEOUT_MS);
    }

    SandboxEventStreamer(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter stream(String threadId, SandboxEventStream events) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        emitter.onTimeout(() -> {
            log.warn("SSE stream for thread {} timed out", threadId);
            events.close();
        });
        emitter.onError(e -> events.close());
        executor.execute(() -> pump(threadId, events, emitter));
        return emitter;
    }

    void pump(String threadId, SandboxEventStream events, SseEmitter emitter) {
        int sent = 0;
        try (events) {
            for (SandboxEvent event : events) {
                emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
                sent++;
            }
            log.debug("SSE stream for thread {} finished after {} events", threadId, sent);
            emitter.complete();
        } catch (IOException e) {
            log.info("Client disconnected from thread {} after {} events", threadId, sent);
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.warn("Relaying events for thread {} failed after {} events: {}", threadId, sent, e.getMessage());
            emitter.completeWithError(e);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}

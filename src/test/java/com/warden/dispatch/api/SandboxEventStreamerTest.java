package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.sandbox.relay.SandboxEvent;
import com.warden.sandbox.relay.SandboxEventStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SandboxEventStreamerTest {

    private final SandboxEventStreamer streamer = new SandboxEventStreamer(5_000L);

    @AfterEach
    void tearDown() {
        streamer.shutdown();
    }

    private static SandboxEventStream events(Runnable onClose, String... lines) {
        return new SandboxEventStream(Stream.of(lines).onClose(onClose), new ObjectMapper());
    }

    /** Captures what would be written to the client. */
    static class RecordingEmitter extends SseEmitter {
        final List<Object> sent = new ArrayList<>();
        boolean completed;
        Throwable failure;
        IOException sendFailure;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            if (sendFailure != null) {
                throw sendFailure;
            }
            builder.build().forEach(part -> sent.add(part.getData()));
        }

        @Override
        public synchronized void complete() {
            completed = true;
        }

        @Override
        public synchronized void completeWithError(Throwable ex) {
            failure = ex;
        }
    }

    @Test
    @DisplayName("forwards every event and completes")
    void forwardsEvents() {
        var closed = new AtomicBoolean();
        var emitter = new RecordingEmitter();

        streamer.pump("t1", events(() -> closed.set(true),
                "data: {\"type\":\"thought\",\"data\":{\"text\":\"a\"}}", "",
                "data: {\"type\":\"result\",\"data\":{\"text\":\"b\"}}", ""), emitter);

        var payloads = emitter.sent.stream().filter(SandboxEvent.class::isInstance).map(SandboxEvent.class::cast).toList();
        assertEquals(List.of("thought", "result"), payloads.stream().map(SandboxEvent::type).toList());
        assertTrue(emitter.completed);
        assertNull(emitter.failure);
        assertTrue(closed.get());
    }

    @Test
    @DisplayName("a disconnected client ends the stream with an error and releases the source")
    void clientGone() {
        var closed = new AtomicBoolean();
        var emitter = new RecordingEmitter();
        emitter.sendFailure = new IOException("Broken pipe");

        streamer.pump("t1", events(() -> closed.set(true), "data: {\"type\":\"thought\"}", ""), emitter);

        assertSame(emitter.sendFailure, emitter.failure);
        assertFalse(emitter.completed);
        assertTrue(closed.get());
    }

    @Test
    @DisplayName("stream pumps on a background thread")
    void streamsInBackground() throws Exception {
        var closed = new CountDownLatch(1);

        var emitter = streamer.stream("t1", events(closed::countDown, "data: {\"type\":\"result\"}", ""));

        assertNotNull(emitter);
        assertEquals(5_000L, emitter.getTimeout());
        assertTrue(closed.await(5, TimeUnit.SECONDS));
    }
}

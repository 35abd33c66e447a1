package com.warden.sandbox.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SandboxEventStreamTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private List<SandboxEvent> parse(String... lines) {
        try (var events = new SandboxEventStream(Stream.of(lines), mapper)) {
            return events.stream().toList();
        }
    }

    @Test
    @DisplayName("blank lines separate events")
    void separatesEvents() {
        var events = parse(
                "data: {\"type\":\"thought\",\"data\":{\"text\":\"a\"}}",
                "",
                "data: {\"type\":\"result\",\"data\":{\"text\":\"b\"},\"thread_id\":\"t1\",\"timestamp\":\"2026-03-01T10:00:00Z\"}",
                "");

        assertEquals(2, events.size());
        assertEquals("thought", events.get(0).type());
        assertEquals("t1", events.get(1).threadId());
        assertEquals("2026-03-01T10:00:00Z", events.get(1).timestamp());
    }

    @Test
    @DisplayName("multi-line data is joined before parsing")
    void joinsDataLines() {
        var events = parse("data: {\"type\":\"tool_end\",", "data: \"data\":{\"ok\":true}}", "");

        assertEquals(1, events.size());
        assertEquals("tool_end", events.get(0).type());
        assertTrue(events.get(0).data().path("ok").asBoolean());
    }

    @Test
    @DisplayName("comments, event names and keep-alives are skipped")
    void skipsNonData() {
        var events = parse(": keep-alive", "", "event: message", "id: 7",
                "data:{\"type\":\"error\",\"data\":{\"message\":\"boom\"}}", "", "", "");

        assertEquals(1, events.size());
        assertEquals("error", events.get(0).type());
        assertTrue(events.get(0).isTerminal());
    }

    @Test
    @DisplayName("a trailing event without a blank line is still delivered")
    void flushesAtEnd() {
        var events = parse("data: {\"type\":\"result\",\"data\":{}}");

        assertEquals(1, events.size());
    }

    @Test
    @DisplayName("unparseable payloads become unknown events")
    void unparseable() {
        var events = parse("data: not json at all", "");

        assertEquals("unknown", events.get(0).type());
        assertEquals("not json at all", events.get(0).data().asText());
        assertFalse(events.get(0).isTerminal());
    }

    @Test
    @DisplayName("unknown fields are ignored")
    void unknownFields() {
        var events = parse("data: {\"type\":\"thought\",\"data\":{},\"seq\":3}", "");

        assertEquals("thought", events.get(0).type());
    }

    @Test
    @DisplayName("only interrupted results count as cancelled")
    void cancelled() {
        var events = parse(
                "data: {\"type\":\"result\",\"data\":{\"subtype\":\"interrupted\"}}", "",
                "data: {\"type\":\"result\",\"data\":{\"subtype\":\"success\"}}", "",
                "data: {\"type\":\"error\",\"data\":{\"subtype\":\"interrupted\"}}", "");

        assertTrue(events.get(0).isCancelled());
        assertFalse(events.get(1).isCancelled());
        assertFalse(events.get(2).isCancelled());
    }

    @Test
    @DisplayName("can be consumed once and closes its source")
    void singleUse() {
        var closed = new AtomicBoolean();
        var events = new SandboxEventStream(Stream.of("data: {\"type\":\"result\"}", "").onClose(() -> closed.set(true)),
                mapper);

        events.forEach(e -> { });
        assertThrows(IllegalStateException.class, events::iterator);

        events.close();
        assertTrue(closed.get());
    }
}

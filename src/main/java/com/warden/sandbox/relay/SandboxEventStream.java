package com.warden.sandbox.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily parsed server-sent events from a sandbox.
 *
 * <p>Events are read from the underlying connection only as the caller iterates, so
 * the first events are available while the sandbox is still working. Close the stream
 * to release the connection early.
 */
public class SandboxEventStream implements Iterable<SandboxEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxEventStream.class);

    static final String UNKNOWN = "unknown";

    private final Stream<String> lines;
    private final ObjectMapper objectMapper;
    private boolean consumed;

    public SandboxEventStream(Stream<String> lines, ObjectMapper objectMapper) {
        this.lines = lines;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalStateException if the stream was already iterated
     */
    @Override
    public Iterator<SandboxEvent> iterator() {
        if (consumed) {
            throw new IllegalStateException("Event stream can only be consumed once");
        }
        consumed = true;
        return new EventIterator(lines.iterator());
    }

    public Stream<SandboxEvent> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    @Override
    public void close() {
        lines.close();
    }

    SandboxEvent parse(String payload) {
        try {
            return objectMapper.readValue(payload, SandboxEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable sandbox event ({} chars)", payload.length());
            return new SandboxEvent(UNKNOWN, TextNode.valueOf(payload), null, null);
        }
    }

    private final class EventIterator implements Iterator<SandboxEvent> {

        private final Iterator<String> source;
        private SandboxEvent next;

        EventIterator(Iterator<String> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = readEvent();
            }
            return next != null;
        }

        @Override
        public SandboxEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var event = next;
            next = null;
            return event;
        }

        // An event ends at a blank line; multiple data lines are joined with newlines.
        private SandboxEvent readEvent() {
            StringBuilder data = null;
            while (source.hasNext()) {
                var line = source.next();
                if (line.isEmpty()) {
                    if (data != null) {
                        return parse(data.toString());
                    }
                    continue;
                }
                if (!line.startsWith("data:")) {
                    continue;
                }
                var value = line.substring(5).stripLeading();
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            return data != null ? parse(data.toString()) : null;
        }
    }
}

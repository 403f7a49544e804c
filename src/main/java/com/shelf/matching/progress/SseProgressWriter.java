package com.shelf.matching.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Writes progress events as Server-Sent Events frames ({@code data: {json}\n\n})
 * and flushes after each one, so a servlet or socket writer streams them as they happen.
 */
public class SseProgressWriter implements ProgressListener {
    private static final Logger log = LoggerFactory.getLogger(SseProgressWriter.class);

    private final Writer writer;
    private final ObjectMapper objectMapper;

    public SseProgressWriter(Writer writer) {
        this(writer, new ObjectMapper());
    }

    public SseProgressWriter(Writer writer, ObjectMapper objectMapper) {
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public void onEvent(ProgressEvent event) {
        String frame = toFrame(event);
        try {
            writer.write(frame);
            writer.flush();
        } catch (IOException e) {
            log.warn("sse.write.failed type={} itemId={}: {}", event.type().wireName(),
                    event.currentItemId(), e.getMessage());
            throw new UncheckedIOException("Failed to write progress event", e);
        }
    }

    /**
     * Serializes one event as an SSE frame.
     */
    public String toFrame(ProgressEvent event) {
        try {
            return "data: " + objectMapper.writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize progress event", e);
        }
    }
}

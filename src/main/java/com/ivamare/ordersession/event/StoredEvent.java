package com.ivamare.ordersession.event;

import java.time.Instant;

/**
 * An event as persisted in a stream.
 *
 * @param streamId Stream (session) the event belongs to
 * @param sequenceNumber Position in the stream, starting at 1 with no gaps
 * @param globalPosition Store-wide position, used only for full replay
 * @param type Event type name
 * @param event Typed payload
 * @param recordedAt When the event was appended
 */
public record StoredEvent(
    String streamId,
    long sequenceNumber,
    long globalPosition,
    String type,
    SessionEvent event,
    Instant recordedAt
) {
    public StoredEvent {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId is required");
        }
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive");
        }
        type = type != null ? type : event.type();
    }
}

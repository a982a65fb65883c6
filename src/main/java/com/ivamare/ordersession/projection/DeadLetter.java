package com.ivamare.ordersession.projection;

import java.time.Instant;

/**
 * An event a subscriber failed to apply after all retries.
 *
 * @param id Storage identifier, null until persisted
 * @param subscriber Subscriber name
 * @param streamId Stream of the event
 * @param sequenceNumber Sequence number of the event
 * @param globalPosition Global position of the event
 * @param eventType Type of the event
 * @param attempts Number of attempts made
 * @param errorMessage Last failure message
 * @param createdAt When the event was dead-lettered
 */
public record DeadLetter(
    Long id,
    String subscriber,
    String streamId,
    long sequenceNumber,
    long globalPosition,
    String eventType,
    int attempts,
    String errorMessage,
    Instant createdAt
) {
    public DeadLetter {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber is required");
        }
        if (streamId == null) {
            throw new IllegalArgumentException("streamId is required");
        }
    }
}

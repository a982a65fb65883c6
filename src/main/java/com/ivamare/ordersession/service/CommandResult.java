package com.ivamare.ordersession.service;

import com.ivamare.ordersession.event.StoredEvent;

import java.util.List;
import java.util.UUID;

/**
 * Result of a successfully handled command.
 *
 * @param sessionId The session
 * @param version Stream version after the append
 * @param events Events appended by the command
 * @param attempts Attempts needed, more than 1 after version conflicts
 */
public record CommandResult(
    UUID sessionId,
    long version,
    List<StoredEvent> events,
    int attempts
) {
    public CommandResult {
        events = List.copyOf(events);
    }
}

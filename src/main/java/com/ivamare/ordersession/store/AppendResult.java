package com.ivamare.ordersession.store;

import com.ivamare.ordersession.event.StoredEvent;

import java.util.List;

/**
 * Outcome of a successful append.
 *
 * @param streamId Stream appended to
 * @param previousVersion Version the append was conditioned on
 * @param newVersion Version after the append
 * @param events The persisted events, in sequence order
 */
public record AppendResult(
    String streamId,
    long previousVersion,
    long newVersion,
    List<StoredEvent> events
) {
    public AppendResult {
        events = List.copyOf(events);
    }
}

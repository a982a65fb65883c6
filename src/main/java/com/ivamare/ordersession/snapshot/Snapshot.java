package com.ivamare.ordersession.snapshot;

import com.ivamare.ordersession.model.OrderSessionState;

import java.time.Instant;

/**
 * A cached fold of a stream up to {@code version}.
 *
 * @param streamId The stream
 * @param version Version of the folded state
 * @param state The folded state
 * @param createdAt When the snapshot was written
 */
public record Snapshot(
    String streamId,
    long version,
    OrderSessionState state,
    Instant createdAt
) {
    public Snapshot {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId is required");
        }
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        if (state.version() != version) {
            throw new IllegalArgumentException("state version " + state.version()
                + " does not match snapshot version " + version);
        }
    }
}

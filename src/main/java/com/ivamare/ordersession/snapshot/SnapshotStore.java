package com.ivamare.ordersession.snapshot;

import com.ivamare.ordersession.model.OrderSessionState;

import java.util.Optional;

/**
 * Store for snapshots. Never authoritative: losing every snapshot only costs replay time.
 */
public interface SnapshotStore {

    /**
     * Save a snapshot. Best effort; failures are logged, never thrown.
     *
     * @param streamId The stream
     * @param version Version of the state
     * @param state The folded state
     */
    void save(String streamId, long version, OrderSessionState state);

    /**
     * Load the snapshot with the highest version.
     *
     * @param streamId The stream
     * @return the latest snapshot, or empty
     */
    Optional<Snapshot> loadLatest(String streamId);

    /**
     * Delete all but the newest {@code keepLatest} snapshots of a stream.
     *
     * @param streamId The stream
     * @param keepLatest Number of snapshots to keep, at least 1
     * @return number of snapshots deleted
     */
    int prune(String streamId, int keepLatest);
}

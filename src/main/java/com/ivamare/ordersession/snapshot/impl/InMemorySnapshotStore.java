package com.ivamare.ordersession.snapshot.impl;

import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.snapshot.Snapshot;
import com.ivamare.ordersession.snapshot.SnapshotStore;

import java.time.Clock;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Snapshot store held in memory.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, NavigableMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySnapshotStore() {
        this(Clock.systemUTC());
    }

    public InMemorySnapshotStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String streamId, long version, OrderSessionState state) {
        snapshots.computeIfAbsent(streamId, id -> new ConcurrentSkipListMap<>())
            .put(version, new Snapshot(streamId, version, state, clock.instant()));
    }

    @Override
    public Optional<Snapshot> loadLatest(String streamId) {
        NavigableMap<Long, Snapshot> stream = snapshots.get(streamId);
        if (stream == null || stream.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(stream.lastEntry()).map(Map.Entry::getValue);
    }

    @Override
    public int prune(String streamId, int keepLatest) {
        NavigableMap<Long, Snapshot> stream = snapshots.get(streamId);
        if (stream == null) {
            return 0;
        }
        int removed = 0;
        while (stream.size() > Math.max(1, keepLatest)) {
            if (stream.pollFirstEntry() != null) {
                removed++;
            }
        }
        return removed;
    }

    public int count(String streamId) {
        NavigableMap<Long, Snapshot> stream = snapshots.get(streamId);
        return stream != null ? stream.size() : 0;
    }
}

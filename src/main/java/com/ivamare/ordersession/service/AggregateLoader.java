package com.ivamare.ordersession.service;

import com.ivamare.ordersession.aggregate.OrderSession;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.OrderSessionException;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.snapshot.Snapshot;
import com.ivamare.ordersession.snapshot.SnapshotStore;
import com.ivamare.ordersession.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads current session state: latest snapshot plus the events after it, or a
 * full replay when there is no usable snapshot. Holds no cache; every call reads
 * the store.
 */
public class AggregateLoader {

    private static final Logger log = LoggerFactory.getLogger(AggregateLoader.class);

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;

    public AggregateLoader(EventStore eventStore, SnapshotStore snapshotStore) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Load the state of a stream.
     *
     * @param streamId The stream
     * @return current state, {@link OrderSessionState#empty()} if the stream does not exist
     */
    public OrderSessionState load(String streamId) {
        Optional<Snapshot> snapshot = latestSnapshot(streamId);
        if (snapshot.isPresent()) {
            try {
                return replay(streamId, snapshot.get().state());
            } catch (IllegalStateException e) {
                log.warn("Snapshot {}@{} does not line up with the stream, replaying in full: {}",
                    streamId, snapshot.get().version(), e.getMessage());
            }
        }
        return replay(streamId, OrderSessionState.empty());
    }

    /**
     * Load the state by full replay, ignoring snapshots.
     */
    public OrderSessionState replay(String streamId) {
        return replay(streamId, OrderSessionState.empty());
    }

    private OrderSessionState replay(String streamId, OrderSessionState from) {
        try (Stream<StoredEvent> events = eventStore.readFrom(streamId, from.version())) {
            return OrderSession.fold(from, events);
        }
    }

    private Optional<Snapshot> latestSnapshot(String streamId) {
        if (snapshotStore == null) {
            return Optional.empty();
        }
        try {
            return snapshotStore.loadLatest(streamId);
        } catch (OrderSessionException e) {
            log.warn("Snapshot load for {} failed, replaying in full: {}", streamId, e.getMessage());
            return Optional.empty();
        }
    }
}

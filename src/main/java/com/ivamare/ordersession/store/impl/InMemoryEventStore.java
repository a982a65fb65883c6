package com.ivamare.ordersession.store.impl;

import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.VersionConflictException;
import com.ivamare.ordersession.store.AppendResult;
import com.ivamare.ordersession.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * Event store held in memory. Appends to one stream are serialized through the
 * stream map's per-key compute; different streams never block each other.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<String, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, StoredEvent> global = new ConcurrentSkipListMap<>();
    private final Object positionLock = new Object();
    private final Clock clock;
    private long lastPosition;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AppendResult append(String streamId, long expectedVersion, List<SessionEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }
        List<StoredEvent> appended = new ArrayList<>(events.size());
        streams.compute(streamId, (id, existing) -> {
            List<StoredEvent> current = existing != null ? existing : List.of();
            long actualVersion = current.size();
            if (actualVersion != expectedVersion) {
                throw new VersionConflictException(streamId, expectedVersion, actualVersion);
            }
            Instant now = clock.instant();
            List<StoredEvent> next = new ArrayList<>(current);
            synchronized (positionLock) {
                long sequence = expectedVersion;
                for (SessionEvent event : events) {
                    StoredEvent stored = new StoredEvent(id, ++sequence, ++lastPosition, event.type(), event, now);
                    next.add(stored);
                    appended.add(stored);
                    global.put(stored.globalPosition(), stored);
                }
            }
            return List.copyOf(next);
        });

        long newVersion = expectedVersion + events.size();
        log.debug("Appended {} events to {} (version {} -> {})", events.size(), streamId, expectedVersion, newVersion);
        return new AppendResult(streamId, expectedVersion, newVersion, appended);
    }

    @Override
    public Stream<StoredEvent> readFrom(String streamId, long fromVersionExclusive) {
        List<StoredEvent> events = streams.getOrDefault(streamId, List.of());
        return events.stream().filter(e -> e.sequenceNumber() > fromVersionExclusive);
    }

    @Override
    public long currentVersion(String streamId) {
        return streams.getOrDefault(streamId, List.of()).size();
    }

    @Override
    public List<StoredEvent> readAll(long afterGlobalPosition, int limit) {
        return global.tailMap(afterGlobalPosition, false).values().stream()
            .limit(limit)
            .toList();
    }

    /**
     * Number of streams held.
     */
    public int streamCount() {
        return streams.size();
    }
}

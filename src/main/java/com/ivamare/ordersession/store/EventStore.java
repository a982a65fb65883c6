package com.ivamare.ordersession.store;

import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.StorageFailureException;
import com.ivamare.ordersession.exception.VersionConflictException;

import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only log of per-session event streams. The only source of truth.
 */
public interface EventStore {

    /**
     * Append events to a stream if, and only if, its current version equals
     * {@code expectedVersion}. Either every event is persisted, numbered
     * contiguously from {@code expectedVersion + 1}, or none is.
     *
     * @param streamId The stream
     * @param expectedVersion Version the caller based its decision on, 0 for a new stream
     * @param events Events to append, not empty
     * @return the persisted events and the new version
     * @throws VersionConflictException if the stream moved on
     * @throws StorageFailureException on storage failure or timeout
     */
    AppendResult append(String streamId, long expectedVersion, List<SessionEvent> events);

    /**
     * Read a stream in sequence order, starting after the given version.
     * The returned stream must be closed by the caller.
     *
     * @param streamId The stream
     * @param fromVersionExclusive Read events with a greater sequence number
     * @return ordered, finite stream of events
     */
    Stream<StoredEvent> readFrom(String streamId, long fromVersionExclusive);

    /**
     * Current version of a stream.
     *
     * @param streamId The stream
     * @return sequence number of the last event, 0 if the stream does not exist
     */
    long currentVersion(String streamId);

    /**
     * Page through all streams in global order. Used to rebuild projections.
     *
     * @param afterGlobalPosition Return events with a greater global position
     * @param limit Maximum number of events
     * @return events ordered by global position
     */
    List<StoredEvent> readAll(long afterGlobalPosition, int limit);

    default boolean streamExists(String streamId) {
        return currentVersion(streamId) > 0;
    }
}

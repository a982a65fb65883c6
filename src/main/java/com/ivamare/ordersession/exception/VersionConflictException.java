package com.ivamare.ordersession.exception;

/**
 * Raised by the event store when an append's expected version does not match
 * the stream's current version. Nothing was persisted.
 */
public class VersionConflictException extends OrderSessionException {

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String streamId, long expectedVersion, long actualVersion) {
        super("Version conflict on stream " + streamId
            + ": expected " + expectedVersion + " but was " + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}

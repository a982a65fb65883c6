package com.ivamare.ordersession.exception;

/**
 * Raised when a subscriber fails to handle an event. Never surfaces to command callers.
 */
public class ProjectionApplicationException extends OrderSessionException {

    private final String subscriber;
    private final String streamId;
    private final long sequenceNumber;

    public ProjectionApplicationException(String subscriber, String streamId, long sequenceNumber, Throwable cause) {
        super("Subscriber " + subscriber + " failed on " + streamId + "#" + sequenceNumber
            + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.subscriber = subscriber;
        this.streamId = streamId;
        this.sequenceNumber = sequenceNumber;
    }

    public String getSubscriber() {
        return subscriber;
    }

    public String getStreamId() {
        return streamId;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }
}

package com.ivamare.ordersession.exception;

/**
 * Raised when a command kept losing the append race until its retries ran out.
 * The caller may resubmit the command.
 */
public class ConcurrencyConflictException extends OrderSessionException {

    private final String streamId;
    private final int attempts;

    public ConcurrencyConflictException(String streamId, int attempts, VersionConflictException lastConflict) {
        super("Gave up on stream " + streamId + " after " + attempts + " conflicting attempts", lastConflict);
        this.streamId = streamId;
        this.attempts = attempts;
    }

    public String getStreamId() {
        return streamId;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isRetryable() {
        return true;
    }
}

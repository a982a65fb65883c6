package com.ivamare.ordersession.exception;

/**
 * Raised when the event, snapshot or dead-letter storage fails or times out.
 *
 * <p>Distinct from {@link VersionConflictException}: the outcome of the operation
 * is a storage problem, not a lost race.
 */
public class StorageFailureException extends OrderSessionException {

    private final boolean transientFailure;

    public StorageFailureException(String message, Throwable cause) {
        this(message, DatabaseExceptionClassifier.isTransient(cause), cause);
    }

    public StorageFailureException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /**
     * Whether the failure is expected to clear on its own (timeouts, lost connections).
     */
    public boolean isTransient() {
        return transientFailure;
    }
}

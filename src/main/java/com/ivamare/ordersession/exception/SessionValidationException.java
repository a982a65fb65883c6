package com.ivamare.ordersession.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a command violates a session invariant. No events are produced
 * and the caller should not retry the same command.
 */
public class SessionValidationException extends OrderSessionException {

    private final ValidationCode code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public SessionValidationException(ValidationCode code, String message) {
        this(code, message, Map.of());
    }

    public SessionValidationException(ValidationCode code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public ValidationCode getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}

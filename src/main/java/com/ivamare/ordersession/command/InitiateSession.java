package com.ivamare.ordersession.command;

import com.ivamare.ordersession.model.SessionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Open a new session. When {@code sessionId} is null the service assigns one.
 */
public record InitiateSession(
    UUID sessionId,
    Long staffId,
    Long locationId,
    SessionType sessionType,
    Integer tableNumber,
    int customerCount,
    Map<String, Object> metadata
) implements SessionCommand {

    public InitiateSession {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public InitiateSession withSessionId(UUID id) {
        return new InitiateSession(id, staffId, locationId, sessionType, tableNumber, customerCount, metadata);
    }
}

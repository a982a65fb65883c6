package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.SessionStatus;
import com.ivamare.ordersession.model.SessionType;
import com.ivamare.ordersession.model.Totals;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * First event of every session stream.
 */
public record SessionInitiated(
    UUID sessionId,
    Long staffId,
    Long locationId,
    SessionType sessionType,
    Integer tableNumber,
    int customerCount,
    Map<String, Object> metadata,
    Instant initiatedAt
) implements SessionEvent {

    public static final String TYPE = "SessionInitiated";

    public SessionInitiated {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        return OrderSessionState.empty().toBuilder()
            .sessionId(sessionId)
            .staffId(staffId)
            .locationId(locationId)
            .sessionType(sessionType)
            .tableNumber(tableNumber)
            .customerCount(customerCount)
            .status(SessionStatus.OPEN)
            .totals(Totals.ZERO)
            .metadata(metadata)
            .openedAt(initiatedAt)
            .build();
    }
}

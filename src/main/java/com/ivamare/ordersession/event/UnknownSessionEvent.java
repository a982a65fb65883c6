package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event whose type this version does not know, kept with its raw payload.
 * Folding it changes nothing.
 */
public record UnknownSessionEvent(
    String type,
    Map<String, Object> payload
) implements SessionEvent {

    public UnknownSessionEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        return state;
    }
}

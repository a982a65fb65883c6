package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Customer details were entered. Fields merge into what was entered before;
 * a field with no value clears it.
 */
public record CustomerInfoEntered(
    Map<String, String> fields,
    boolean complete,
    Instant enteredAt
) implements SessionEvent {

    public static final String TYPE = "CustomerInfoEntered";

    public CustomerInfoEntered {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        Map<String, String> merged = new LinkedHashMap<>(state.customerInfo());
        fields.forEach((field, value) -> {
            if (value == null) {
                merged.remove(field);
            } else {
                merged.put(field, value);
            }
        });
        return state.toBuilder()
            .customerInfo(merged)
            .customerInfoComplete(complete)
            .build();
    }
}

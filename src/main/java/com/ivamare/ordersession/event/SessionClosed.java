package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.SessionStatus;
import com.ivamare.ordersession.model.Totals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The session was closed. Totals are frozen in the payload and copied as-is on replay.
 */
public record SessionClosed(
    Totals totals,
    BigDecimal taxRate,
    String closedBy,
    Instant closedAt
) implements SessionEvent {

    public static final String TYPE = "SessionClosed";

    public SessionClosed {
        totals = totals != null ? totals : Totals.ZERO;
        taxRate = taxRate != null ? taxRate : BigDecimal.ZERO;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        return state.toBuilder()
            .status(SessionStatus.CLOSED)
            .totals(totals)
            .closedAt(closedAt)
            .closedBy(closedBy)
            .build();
    }
}

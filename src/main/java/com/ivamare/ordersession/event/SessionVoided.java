package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.SessionStatus;

import java.time.Instant;

/**
 * The session was voided. Prior events stay in the stream untouched.
 */
public record SessionVoided(
    String reason,
    String voidedBy,
    Instant voidedAt
) implements SessionEvent {

    public static final String TYPE = "SessionVoided";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        return state.toBuilder()
            .status(SessionStatus.VOIDED)
            .voidedAt(voidedAt)
            .voidedBy(voidedBy)
            .voidReason(reason)
            .build();
    }
}

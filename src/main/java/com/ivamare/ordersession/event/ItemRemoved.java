package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.AppliedDiscount;
import com.ivamare.ordersession.model.LineItem;
import com.ivamare.ordersession.model.OrderSessionState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A line was removed, together with any discounts scoped to it.
 */
public record ItemRemoved(
    UUID lineId,
    String reason,
    Instant removedAt
) implements SessionEvent {

    public static final String TYPE = "ItemRemoved";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        List<LineItem> lines = state.lineItems().stream()
            .filter(line -> !line.lineId().equals(lineId))
            .toList();
        List<AppliedDiscount> discounts = state.appliedDiscounts().stream()
            .filter(discount -> !discount.appliesTo(lineId))
            .toList();
        return state.toBuilder()
            .lineItems(lines)
            .appliedDiscounts(discounts)
            .build()
            .recalculated();
    }
}

package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.LineItem;
import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.OrderSessionState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A line's quantity or notes changed; it carries the re-quoted price.
 */
public record ItemModified(
    UUID lineId,
    int quantity,
    BigDecimal unitPrice,
    List<String> appliedRuleIds,
    String notes,
    Instant modifiedAt
) implements SessionEvent {

    public static final String TYPE = "ItemModified";

    public ItemModified {
        unitPrice = Money.of(unitPrice);
        appliedRuleIds = appliedRuleIds != null ? List.copyOf(appliedRuleIds) : List.of();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        List<LineItem> lines = state.lineItems().stream()
            .map(line -> line.lineId().equals(lineId)
                ? line.withPricing(quantity, unitPrice, appliedRuleIds, notes)
                : line)
            .toList();
        return state.toBuilder()
            .lineItems(lines)
            .build()
            .recalculated();
    }
}

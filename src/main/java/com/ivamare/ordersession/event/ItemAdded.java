package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.LineItem;
import com.ivamare.ordersession.model.LineModifier;
import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.OrderSessionState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A line was added. The unit price and applied pricing rules are the ones
 * quoted when the command was handled and are never re-evaluated. Modifier
 * prices come with the command.
 */
public record ItemAdded(
    UUID lineId,
    Long itemId,
    Long variantId,
    String itemName,
    int quantity,
    BigDecimal unitPrice,
    List<LineModifier> modifiers,
    List<String> appliedRuleIds,
    String notes,
    Instant addedAt
) implements SessionEvent {

    public static final String TYPE = "ItemAdded";

    public ItemAdded {
        unitPrice = Money.of(unitPrice);
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        appliedRuleIds = appliedRuleIds != null ? List.copyOf(appliedRuleIds) : List.of();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        List<LineItem> lines = new ArrayList<>(state.lineItems());
        lines.add(new LineItem(lineId, itemId, variantId, itemName, quantity, unitPrice, modifiers,
            appliedRuleIds, notes));
        return state.toBuilder()
            .lineItems(lines)
            .build()
            .recalculated();
    }
}

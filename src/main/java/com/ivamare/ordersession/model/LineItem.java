package com.ivamare.ordersession.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * An ordered item within a session. The unit price is the price captured
 * when the item was added or last modified.
 *
 * @param lineId Unique line identifier within the session
 * @param itemId Menu item identifier
 * @param variantId Optional variant (size, preparation)
 * @param itemName Optional display name captured at order time
 * @param quantity Number of units, always positive
 * @param unitPrice Price per unit
 * @param modifiers Add-ons charged per unit on top of the unit price
 * @param appliedRuleIds Pricing rules that produced the unit price
 * @param notes Optional kitchen notes
 */
public record LineItem(
    UUID lineId,
    Long itemId,
    Long variantId,
    String itemName,
    int quantity,
    BigDecimal unitPrice,
    List<LineModifier> modifiers,
    List<String> appliedRuleIds,
    String notes
) {
    public LineItem {
        if (lineId == null) {
            throw new IllegalArgumentException("lineId is required");
        }
        unitPrice = Money.of(unitPrice);
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
        appliedRuleIds = appliedRuleIds != null ? List.copyOf(appliedRuleIds) : List.of();
    }

    public BigDecimal modifiersTotal() {
        return modifiers.stream()
            .map(LineModifier::price)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    /**
     * Gross amount of this line before discounts: unit price plus modifiers, times quantity.
     */
    public BigDecimal lineTotal() {
        return Money.of(unitPrice.add(modifiersTotal()).multiply(BigDecimal.valueOf(quantity)));
    }

    public LineItem withPricing(int quantity, BigDecimal unitPrice, List<String> appliedRuleIds, String notes) {
        return new LineItem(lineId, itemId, variantId, itemName, quantity, unitPrice, modifiers, appliedRuleIds,
            notes != null ? notes : this.notes);
    }
}

package com.ivamare.ordersession.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A discount applied to the whole session or to a single line.
 *
 * @param discountId Unique discount identifier
 * @param kind Percentage or fixed amount
 * @param value Percentage points or money amount
 * @param scope SESSION or LINE
 * @param lineId Target line for LINE scope, null otherwise
 * @param reason Optional free-text reason (manager comp, happy hour)
 * @param appliedAt When the discount was applied
 */
public record AppliedDiscount(
    UUID discountId,
    DiscountKind kind,
    BigDecimal value,
    DiscountScope scope,
    UUID lineId,
    String reason,
    Instant appliedAt
) {
    public AppliedDiscount {
        if (discountId == null) {
            throw new IllegalArgumentException("discountId is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope is required");
        }
        value = Money.of(value);
    }

    public boolean appliesTo(UUID targetLineId) {
        return scope == DiscountScope.LINE && lineId != null && lineId.equals(targetLineId);
    }

    /**
     * Amount this discount takes off the given base, never more than the base.
     *
     * @param base the amount the discount is applied to
     * @return the discount amount, scale 2
     */
    public BigDecimal amountOn(BigDecimal base) {
        BigDecimal amount = kind == DiscountKind.PERCENTAGE
            ? Money.percentOf(base, value)
            : Money.of(value);
        return Money.min(amount, Money.of(base));
    }
}

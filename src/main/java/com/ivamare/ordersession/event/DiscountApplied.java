package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.AppliedDiscount;
import com.ivamare.ordersession.model.DiscountKind;
import com.ivamare.ordersession.model.DiscountScope;
import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.OrderSessionState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A discount was applied to the session or to one line.
 */
public record DiscountApplied(
    UUID discountId,
    DiscountKind kind,
    BigDecimal value,
    DiscountScope scope,
    UUID lineId,
    String reason,
    Instant appliedAt
) implements SessionEvent {

    public static final String TYPE = "DiscountApplied";

    public DiscountApplied {
        value = Money.of(value);
        scope = scope != null ? scope : DiscountScope.SESSION;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        List<AppliedDiscount> discounts = new ArrayList<>(state.appliedDiscounts());
        discounts.add(new AppliedDiscount(discountId, kind, value, scope, lineId, reason, appliedAt));
        return state.toBuilder()
            .appliedDiscounts(discounts)
            .build()
            .recalculated();
    }
}

package com.ivamare.ordersession.command;

import com.ivamare.ordersession.model.DiscountKind;
import com.ivamare.ordersession.model.DiscountScope;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Apply a discount to the session, or to one line when {@code scope} is LINE.
 */
public record ApplyDiscount(
    DiscountKind kind,
    BigDecimal value,
    DiscountScope scope,
    UUID lineId,
    String reason
) implements SessionCommand {

    public ApplyDiscount {
        scope = scope != null ? scope : DiscountScope.SESSION;
    }

    public static ApplyDiscount sessionPercentage(String percent) {
        return new ApplyDiscount(DiscountKind.PERCENTAGE, new BigDecimal(percent), DiscountScope.SESSION, null, null);
    }
}

package com.ivamare.ordersession.pricing;

import com.ivamare.ordersession.model.Money;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price returned by the pricing collaborator for one line.
 *
 * @param unitPrice Price per unit after pricing rules
 * @param appliedRuleIds Identifiers of the rules that were applied
 */
public record PriceQuote(BigDecimal unitPrice, List<String> appliedRuleIds) {

    public PriceQuote {
        if (unitPrice == null) {
            throw new IllegalArgumentException("unitPrice is required");
        }
        unitPrice = Money.of(unitPrice);
        appliedRuleIds = appliedRuleIds != null ? List.copyOf(appliedRuleIds) : List.of();
    }

    public static PriceQuote of(String unitPrice) {
        return new PriceQuote(new BigDecimal(unitPrice), List.of());
    }
}

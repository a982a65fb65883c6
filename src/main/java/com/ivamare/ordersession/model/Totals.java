package com.ivamare.ordersession.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Money totals of a session.
 *
 * <p>Line discounts come off their line first, then session discounts are taken
 * in order from what remains. The discount total never exceeds the subtotal.
 *
 * @param subtotal Sum of line gross amounts, unit price plus modifiers times quantity
 * @param discountTotal Line and session discounts combined
 * @param taxTotal Tax on the discounted amount
 * @param grandTotal subtotal - discountTotal + taxTotal
 */
public record Totals(
    BigDecimal subtotal,
    BigDecimal discountTotal,
    BigDecimal taxTotal,
    BigDecimal grandTotal
) {
    public static final Totals ZERO = new Totals(Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO);

    public Totals {
        subtotal = Money.of(subtotal);
        discountTotal = Money.of(discountTotal);
        taxTotal = Money.of(taxTotal);
        grandTotal = Money.of(grandTotal);
    }

    /**
     * Compute totals for the given lines and discounts.
     *
     * @param lineItems current lines
     * @param discounts applied discounts, in application order
     * @param taxRate tax rate as a fraction (0.08 for 8%), zero while the session is open
     * @return the computed totals
     */
    public static Totals calculate(List<LineItem> lineItems, List<AppliedDiscount> discounts, BigDecimal taxRate) {
        BigDecimal subtotal = Money.ZERO;
        BigDecimal lineDiscounts = Money.ZERO;

        for (LineItem line : lineItems) {
            BigDecimal gross = line.lineTotal();
            subtotal = subtotal.add(gross);

            BigDecimal remaining = gross;
            for (AppliedDiscount discount : discounts) {
                if (discount.appliesTo(line.lineId())) {
                    BigDecimal amount = discount.amountOn(remaining);
                    remaining = remaining.subtract(amount);
                    lineDiscounts = lineDiscounts.add(amount);
                }
            }
        }

        BigDecimal net = subtotal.subtract(lineDiscounts);
        BigDecimal sessionDiscounts = Money.ZERO;
        for (AppliedDiscount discount : discounts) {
            if (discount.scope() == DiscountScope.SESSION) {
                BigDecimal amount = discount.amountOn(net);
                net = net.subtract(amount);
                sessionDiscounts = sessionDiscounts.add(amount);
            }
        }

        BigDecimal discountTotal = lineDiscounts.add(sessionDiscounts);
        BigDecimal rate = taxRate != null ? taxRate : BigDecimal.ZERO;
        BigDecimal taxTotal = Money.of(net.multiply(rate));
        return new Totals(subtotal, discountTotal, taxTotal, net.add(taxTotal));
    }
}

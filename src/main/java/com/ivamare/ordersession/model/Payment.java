package com.ivamare.ordersession.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment recorded against a session.
 *
 * @param paymentId Unique payment identifier
 * @param method Tender type (cash, card, voucher)
 * @param amount Amount applied to the bill
 * @param tip Gratuity on top of the amount
 * @param reference Optional processor reference
 * @param recordedAt When the payment was taken
 */
public record Payment(
    UUID paymentId,
    String method,
    BigDecimal amount,
    BigDecimal tip,
    String reference,
    Instant recordedAt
) {
    public Payment {
        if (paymentId == null) {
            throw new IllegalArgumentException("paymentId is required");
        }
        amount = Money.of(amount);
        tip = Money.of(tip);
    }
}

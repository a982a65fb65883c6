package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.Payment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A payment was taken. Payments do not change the totals.
 */
public record PaymentRecorded(
    UUID paymentId,
    String method,
    BigDecimal amount,
    BigDecimal tip,
    String reference,
    Instant recordedAt
) implements SessionEvent {

    public static final String TYPE = "PaymentRecorded";

    public PaymentRecorded {
        amount = Money.of(amount);
        tip = Money.of(tip);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public OrderSessionState applyTo(OrderSessionState state) {
        List<Payment> payments = new ArrayList<>(state.payments());
        payments.add(new Payment(paymentId, method, amount, tip, reference, recordedAt));
        return state.toBuilder()
            .payments(payments)
            .build();
    }
}

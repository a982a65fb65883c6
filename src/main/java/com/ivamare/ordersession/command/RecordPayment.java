package com.ivamare.ordersession.command;

import java.math.BigDecimal;

public record RecordPayment(
    String method,
    BigDecimal amount,
    BigDecimal tip,
    String reference
) implements SessionCommand {
}

package com.ivamare.ordersession.command;

import java.math.BigDecimal;

/**
 * Close the session and freeze its totals.
 *
 * @param closedBy Who closed the session
 * @param taxRate Tax rate as a fraction; null means no tax
 */
public record CloseSession(String closedBy, BigDecimal taxRate) implements SessionCommand {

    public static CloseSession withoutTax() {
        return new CloseSession(null, null);
    }
}

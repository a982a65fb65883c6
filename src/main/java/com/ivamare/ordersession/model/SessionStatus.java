package com.ivamare.ordersession.model;

/**
 * Status of an order session in its lifecycle.
 */
public enum SessionStatus {
    /** Session accepts item, discount and payment changes */
    OPEN("OPEN"),

    /** Totals frozen, terminal */
    CLOSED("CLOSED"),

    /** Cancelled, terminal */
    VOIDED("VOIDED");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown SessionStatus: " + value);
    }
}

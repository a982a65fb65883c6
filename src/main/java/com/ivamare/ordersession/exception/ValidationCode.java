package com.ivamare.ordersession.exception;

/**
 * Reasons a command is rejected by the aggregate.
 */
public enum ValidationCode {
    /** Command not allowed in the session's current status */
    INVALID_STATE_TRANSITION,

    /** Initiate on a stream that already has events */
    SESSION_ALREADY_EXISTS,

    /** Any command other than initiate on an empty stream */
    SESSION_NOT_FOUND,

    MISSING_LOCATION,
    MISSING_SESSION_TYPE,
    INVALID_CUSTOMER_COUNT,
    INVALID_TABLE_NUMBER,

    /** Quantity zero or below */
    NEGATIVE_QUANTITY,

    UNKNOWN_LINE_ITEM,
    INVALID_DISCOUNT,
    INVALID_PAYMENT,
    INVALID_TAX_RATE,

    /** Modifier without a name or with a negative price */
    INVALID_MODIFIER,

    /** Customer details with no fields or a blank field name */
    INVALID_CUSTOMER_INFO,

    MISSING_REASON,

    /** The pricing collaborator failed or returned no price */
    PRICING_UNAVAILABLE
}

package com.ivamare.ordersession.model;

/**
 * How a discount value is interpreted.
 */
public enum DiscountKind {
    /** Value is a percentage (0-100] of the discounted base */
    PERCENTAGE,

    /** Value is an absolute money amount */
    FIXED_AMOUNT
}

package com.ivamare.ordersession.model;

/**
 * What a discount applies to.
 */
public enum DiscountScope {
    SESSION,
    LINE
}

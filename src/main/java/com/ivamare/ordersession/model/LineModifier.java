package com.ivamare.ordersession.model;

import java.math.BigDecimal;

/**
 * An add-on or customization chosen for a line, such as extra cheese.
 *
 * @param name Display name
 * @param price Surcharge per unit of the line, zero when free
 */
public record LineModifier(
    String name,
    BigDecimal price
) {
    public LineModifier {
        price = Money.of(price);
    }
}

package com.ivamare.ordersession.pricing;

import java.time.Instant;

/**
 * Prices a line at command time. The quote is captured in the emitted event
 * and never requested again when the stream is replayed.
 */
@FunctionalInterface
public interface PricingService {

    /**
     * Price a line.
     *
     * @param itemId Menu item
     * @param variantId Optional variant, may be null
     * @param locationId Location whose price list applies
     * @param quantity Requested quantity
     * @param asOf Time the price applies to
     * @return the quote
     */
    PriceQuote priceForLine(Long itemId, Long variantId, Long locationId, int quantity, Instant asOf);
}

package com.ivamare.ordersession.event;

import com.ivamare.ordersession.model.OrderSessionState;

/**
 * A domain event in an order session stream.
 *
 * <p>The set of event types is closed. Each event knows how to derive the next
 * state from the previous one; applying an event never fails and never consults
 * anything outside its own payload.
 */
public sealed interface SessionEvent permits
        SessionInitiated,
        ItemAdded,
        ItemRemoved,
        ItemModified,
        CustomerInfoEntered,
        DiscountApplied,
        PaymentRecorded,
        SessionClosed,
        SessionVoided,
        UnknownSessionEvent {

    /**
     * Stable type name, stored alongside the payload.
     */
    String type();

    /**
     * Derive the next state. The version is set by the caller.
     *
     * @param state state before this event
     * @return state after this event
     */
    OrderSessionState applyTo(OrderSessionState state);
}

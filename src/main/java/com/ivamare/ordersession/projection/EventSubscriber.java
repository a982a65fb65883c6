package com.ivamare.ordersession.projection;

import com.ivamare.ordersession.event.StoredEvent;

/**
 * Receives appended events in per-stream order, at least once.
 *
 * <p>Subscribers that only have side effects (notifying other systems) implement
 * this interface directly and are never replayed by a rebuild.
 */
public interface EventSubscriber {

    /**
     * Unique name, used for checkpoints and dead letters.
     */
    String name();

    /**
     * Handle one event. Throwing marks the delivery as failed; it will be retried
     * and eventually dead-lettered.
     *
     * @param event the event
     */
    void handle(StoredEvent event);
}

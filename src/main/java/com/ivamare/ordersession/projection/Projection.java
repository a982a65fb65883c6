package com.ivamare.ordersession.projection;

/**
 * A read model derived only from events, and therefore rebuildable from the log.
 */
public interface Projection extends EventSubscriber {

    /**
     * Discard all derived data. Called before a rebuild replays the log.
     */
    void reset();
}

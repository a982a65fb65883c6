package com.ivamare.ordersession.projection;

import com.ivamare.ordersession.event.StoredEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers appended events to subscribers, asynchronously and idempotently.
 */
public interface ProjectionEngine {

    /**
     * Dispatch events in the background. The returned future completes when
     * every subscriber has handled or dead-lettered them; it never completes
     * exceptionally because of a subscriber failure.
     *
     * @param events events of one append, in sequence order
     * @return completion of the dispatch
     */
    CompletableFuture<Void> publish(List<StoredEvent> events);

    /**
     * Dispatch events on the calling thread.
     *
     * @param events events in sequence order per stream
     */
    void apply(List<StoredEvent> events);

    /**
     * Reset every {@link Projection} and replay the whole log into them.
     * Side-effecting subscribers are not replayed.
     *
     * @return number of events replayed
     */
    long rebuild();

    /**
     * Retry every dead-lettered subscriber and stream, deleting the dead letters
     * whose stream now catches up.
     *
     * @return number of streams recovered
     */
    int retryDeadLetters();

    List<EventSubscriber> subscribers();

    /**
     * Total successful deliveries since start.
     */
    long eventsApplied();

    /**
     * Stop background dispatch, waiting briefly for in-flight work.
     */
    void shutdown();
}

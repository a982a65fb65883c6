package com.ivamare.ordersession.projection;

import java.util.List;

/**
 * Storage for dead-lettered projection deliveries.
 */
public interface DeadLetterRepository {

    /**
     * Record a dead letter. A second failure of the same subscriber, stream and
     * sequence replaces the first.
     */
    void save(DeadLetter deadLetter);

    List<DeadLetter> findAll();

    List<DeadLetter> findBySubscriber(String subscriber);

    /**
     * Remove all dead letters of a subscriber for one stream.
     *
     * @return number removed
     */
    int delete(String subscriber, String streamId);

    /**
     * Remove all dead letters of a subscriber.
     *
     * @return number removed
     */
    int deleteBySubscriber(String subscriber);

    long count();
}

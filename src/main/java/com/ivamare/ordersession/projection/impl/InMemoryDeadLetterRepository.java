package com.ivamare.ordersession.projection.impl;

import com.ivamare.ordersession.projection.DeadLetter;
import com.ivamare.ordersession.projection.DeadLetterRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dead letters held in memory.
 */
public class InMemoryDeadLetterRepository implements DeadLetterRepository {

    private final Map<String, DeadLetter> deadLetters = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public void save(DeadLetter deadLetter) {
        String key = deadLetter.subscriber() + "|" + deadLetter.streamId() + "|" + deadLetter.sequenceNumber();
        deadLetters.put(key, new DeadLetter(
            ids.incrementAndGet(),
            deadLetter.subscriber(),
            deadLetter.streamId(),
            deadLetter.sequenceNumber(),
            deadLetter.globalPosition(),
            deadLetter.eventType(),
            deadLetter.attempts(),
            deadLetter.errorMessage(),
            deadLetter.createdAt()
        ));
    }

    @Override
    public List<DeadLetter> findAll() {
        List<DeadLetter> all = new ArrayList<>(deadLetters.values());
        all.sort(Comparator.comparing(DeadLetter::id));
        return all;
    }

    @Override
    public List<DeadLetter> findBySubscriber(String subscriber) {
        return findAll().stream()
            .filter(d -> d.subscriber().equals(subscriber))
            .toList();
    }

    @Override
    public int delete(String subscriber, String streamId) {
        int before = deadLetters.size();
        deadLetters.values().removeIf(d -> d.subscriber().equals(subscriber) && d.streamId().equals(streamId));
        return before - deadLetters.size();
    }

    @Override
    public int deleteBySubscriber(String subscriber) {
        int before = deadLetters.size();
        deadLetters.values().removeIf(d -> d.subscriber().equals(subscriber));
        return before - deadLetters.size();
    }

    @Override
    public long count() {
        return deadLetters.size();
    }
}

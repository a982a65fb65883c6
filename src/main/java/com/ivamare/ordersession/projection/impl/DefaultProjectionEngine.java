package com.ivamare.ordersession.projection.impl;

import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.ProjectionApplicationException;
import com.ivamare.ordersession.exception.StorageFailureException;
import com.ivamare.ordersession.policy.RetryPolicy;
import com.ivamare.ordersession.projection.DeadLetter;
import com.ivamare.ordersession.projection.DeadLetterRepository;
import com.ivamare.ordersession.projection.EventSubscriber;
import com.ivamare.ordersession.projection.Projection;
import com.ivamare.ordersession.projection.ProjectionCheckpoints;
import com.ivamare.ordersession.projection.ProjectionEngine;
import com.ivamare.ordersession.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Default projection engine.
 *
 * <p>Per subscriber and stream, events apply strictly in sequence order:
 * <ul>
 *   <li>an event at or below the checkpoint is a redelivery and is skipped</li>
 *   <li>an event past the next expected sequence first pulls the missing events from the store</li>
 *   <li>a failing event is retried per the retry policy, then dead-lettered; the stream
 *       then stays behind for that subscriber until {@link #retryDeadLetters()}</li>
 * </ul>
 *
 * <p>One subscriber's failure never blocks other subscribers or other streams.
 */
public class DefaultProjectionEngine implements ProjectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultProjectionEngine.class);

    private static final int LOCK_STRIPES = 64;

    /** Event type recorded when the stored event could not be read back */
    static final String UNREADABLE_EVENT_TYPE = "unreadable";

    private final EventStore eventStore;
    private final List<EventSubscriber> subscribers;
    private final ProjectionCheckpoints checkpoints;
    private final DeadLetterRepository deadLetterRepository;
    private final RetryPolicy retryPolicy;
    private final int rebuildPageSize;
    private final Clock clock;
    private final ExecutorService executor;

    private final Object[] streamLocks = new Object[LOCK_STRIPES];
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();
    private final AtomicLong eventsApplied = new AtomicLong();

    public DefaultProjectionEngine(EventStore eventStore,
                                   List<EventSubscriber> subscribers,
                                   DeadLetterRepository deadLetterRepository,
                                   RetryPolicy retryPolicy,
                                   int concurrency,
                                   int rebuildPageSize,
                                   Clock clock) {
        Set<String> names = new HashSet<>();
        for (EventSubscriber subscriber : subscribers) {
            if (!names.add(subscriber.name())) {
                throw new IllegalArgumentException("Duplicate subscriber name: " + subscriber.name());
            }
        }

        this.eventStore = eventStore;
        this.subscribers = List.copyOf(subscribers);
        this.checkpoints = new ProjectionCheckpoints();
        this.deadLetterRepository = deadLetterRepository;
        this.retryPolicy = retryPolicy;
        this.rebuildPageSize = Math.max(1, rebuildPageSize);
        this.clock = clock;
        for (int i = 0; i < streamLocks.length; i++) {
            streamLocks[i] = new Object();
        }
        this.executor = Executors.newFixedThreadPool(Math.max(1, concurrency), new DispatchThreadFactory());
        log.info("Projection engine started with subscribers {}", names);
    }

    @Override
    public CompletableFuture<Void> publish(List<StoredEvent> events) {
        if (events.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> apply(events), executor)
            .exceptionally(e -> {
                log.error("Dispatch of {} events failed", events.size(), e);
                return null;
            });
    }

    @Override
    public void apply(List<StoredEvent> events) {
        rebuildLock.readLock().lock();
        try {
            for (StoredEvent event : events) {
                for (EventSubscriber subscriber : subscribers) {
                    deliver(subscriber, event);
                }
            }
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    @Override
    public long rebuild() {
        List<EventSubscriber> projections = subscribers.stream()
            .filter(Projection.class::isInstance)
            .toList();

        rebuildLock.writeLock().lock();
        try {
            log.info("Rebuilding {} projections", projections.size());
            for (EventSubscriber projection : projections) {
                ((Projection) projection).reset();
                checkpoints.reset(projection.name());
                blocked.removeIf(key -> key.startsWith(projection.name() + "|"));
                deadLetterRepository.deleteBySubscriber(projection.name());
            }

            long replayed = 0;
            long position = 0;
            List<StoredEvent> page = eventStore.readAll(position, rebuildPageSize);
            while (!page.isEmpty()) {
                for (StoredEvent event : page) {
                    for (EventSubscriber projection : projections) {
                        deliver(projection, event);
                    }
                    position = event.globalPosition();
                    replayed++;
                }
                page = page.size() < rebuildPageSize ? List.of() : eventStore.readAll(position, rebuildPageSize);
            }

            log.info("Rebuild complete, replayed {} events", replayed);
            return replayed;
        } finally {
            rebuildLock.writeLock().unlock();
        }
    }

    @Override
    public int retryDeadLetters() {
        List<DeadLetter> deadLetters = deadLetterRepository.findAll();
        Set<String> attempted = new HashSet<>();
        int recovered = 0;

        rebuildLock.readLock().lock();
        try {
            for (DeadLetter deadLetter : deadLetters) {
                String key = key(deadLetter.subscriber(), deadLetter.streamId());
                if (!attempted.add(key)) {
                    continue;
                }
                EventSubscriber subscriber = findSubscriber(deadLetter.subscriber());
                if (subscriber == null) {
                    log.warn("Dead letter for unknown subscriber {} left in place", deadLetter.subscriber());
                    continue;
                }
                synchronized (lockFor(key)) {
                    blocked.remove(key);
                    if (catchUp(subscriber, deadLetter.streamId(), Long.MAX_VALUE)) {
                        deadLetterRepository.delete(subscriber.name(), deadLetter.streamId());
                        recovered++;
                        log.info("Recovered {} for subscriber {}", deadLetter.streamId(), subscriber.name());
                    }
                }
            }
        } finally {
            rebuildLock.readLock().unlock();
        }
        return recovered;
    }

    @Override
    public List<EventSubscriber> subscribers() {
        return subscribers;
    }

    @Override
    public long eventsApplied() {
        return eventsApplied.get();
    }

    /**
     * Streams held back for some subscriber after a dead letter.
     */
    public int blockedCount() {
        return blocked.size();
    }

    public long checkpoint(String subscriber, String streamId) {
        return checkpoints.lastApplied(subscriber, streamId);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Projection engine stopped");
    }

    // --- Delivery ---

    private void deliver(EventSubscriber subscriber, StoredEvent event) {
        String key = key(subscriber.name(), event.streamId());
        synchronized (lockFor(key)) {
            if (blocked.contains(key)) {
                log.debug("Skipping {}#{} for {}: stream is dead-lettered",
                    event.streamId(), event.sequenceNumber(), subscriber.name());
                return;
            }

            long last = checkpoints.lastApplied(subscriber.name(), event.streamId());
            if (event.sequenceNumber() <= last) {
                log.debug("Skipping redelivered {}#{} for {}", event.streamId(), event.sequenceNumber(), subscriber.name());
                return;
            }
            if (event.sequenceNumber() > last + 1
                    && !catchUp(subscriber, event.streamId(), event.sequenceNumber() - 1)) {
                return;
            }
            applyWithRetry(subscriber, event);
        }
    }

    /**
     * Apply the events of a stream after the subscriber's checkpoint, up to and
     * including {@code upToSequence}. Returns false if a dead letter stopped it.
     */
    private boolean catchUp(EventSubscriber subscriber, String streamId, long upToSequence) {
        long from = checkpoints.lastApplied(subscriber.name(), streamId);
        log.debug("Catching up {} on {} from {}", subscriber.name(), streamId, from);
        try (Stream<StoredEvent> missing = eventStore.readFrom(streamId, from)) {
            Iterator<StoredEvent> it = missing.iterator();
            while (it.hasNext()) {
                StoredEvent event = it.next();
                if (event.sequenceNumber() > upToSequence) {
                    break;
                }
                if (!applyWithRetry(subscriber, event)) {
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            if (e instanceof StorageFailureException storageFailure && storageFailure.isTransient()) {
                log.warn("Catch-up of {} on {} failed, next delivery retries: {}",
                    subscriber.name(), streamId, e.getMessage());
                return false;
            }
            long next = checkpoints.lastApplied(subscriber.name(), streamId) + 1;
            deadLetter(subscriber, streamId, next, 0L, UNREADABLE_EVENT_TYPE, 1,
                new ProjectionApplicationException(subscriber.name(), streamId, next, e));
            return false;
        }
    }

    private boolean applyWithRetry(EventSubscriber subscriber, StoredEvent event) {
        int attempt = 1;
        while (true) {
            try {
                subscriber.handle(event);
                checkpoints.advance(subscriber.name(), event.streamId(), event.sequenceNumber());
                eventsApplied.incrementAndGet();
                return true;
            } catch (RuntimeException e) {
                if (!retryPolicy.shouldRetry(attempt)) {
                    deadLetter(subscriber, event.streamId(), event.sequenceNumber(), event.globalPosition(),
                        event.type(), attempt, new ProjectionApplicationException(subscriber.name(), event.streamId(), event.sequenceNumber(), e));
                    return false;
                }
                long backoff = retryPolicy.getJitteredBackoff(attempt);
                log.debug("Subscriber {} failed on {}#{} (attempt {}/{}), retrying in {}ms: {}",
                    subscriber.name(), event.streamId(), event.sequenceNumber(),
                    attempt, retryPolicy.maxAttempts(), backoff, e.getMessage());
                sleep(backoff);
                attempt++;
            }
        }
    }

    private void deadLetter(EventSubscriber subscriber, String streamId, long sequenceNumber, long globalPosition,
                            String eventType, int attempts, ProjectionApplicationException failure) {
        blocked.add(key(subscriber.name(), streamId));
        log.error("Dead-lettering {}#{} for subscriber {} after {} attempts",
            streamId, sequenceNumber, subscriber.name(), attempts, failure);
        try {
            deadLetterRepository.save(new DeadLetter(
                null,
                subscriber.name(),
                streamId,
                sequenceNumber,
                globalPosition,
                eventType,
                attempts,
                failure.getCause() != null ? failure.getCause().getMessage() : failure.getMessage(),
                clock.instant()
            ));
        } catch (RuntimeException e) {
            log.error("Failed to record dead letter for {}#{}", streamId, sequenceNumber, e);
        }
    }

    private EventSubscriber findSubscriber(String name) {
        return subscribers.stream()
            .filter(s -> s.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    private Object lockFor(String key) {
        return streamLocks[Math.floorMod(key.hashCode(), streamLocks.length)];
    }

    private static String key(String subscriber, String streamId) {
        return subscriber + "|" + streamId;
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "ordersession-projection-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

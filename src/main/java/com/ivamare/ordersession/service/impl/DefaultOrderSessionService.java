package com.ivamare.ordersession.service.impl;

import com.ivamare.ordersession.aggregate.OrderSession;
import com.ivamare.ordersession.command.AddItem;
import com.ivamare.ordersession.command.ApplyDiscount;
import com.ivamare.ordersession.command.CloseSession;
import com.ivamare.ordersession.command.EnterCustomerInfo;
import com.ivamare.ordersession.command.CommandContext;
import com.ivamare.ordersession.command.InitiateSession;
import com.ivamare.ordersession.command.ModifyItem;
import com.ivamare.ordersession.command.RecordPayment;
import com.ivamare.ordersession.command.RemoveItem;
import com.ivamare.ordersession.command.SessionCommand;
import com.ivamare.ordersession.command.VoidSession;
import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.ConcurrencyConflictException;
import com.ivamare.ordersession.exception.SessionValidationException;
import com.ivamare.ordersession.exception.VersionConflictException;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.policy.RetryPolicy;
import com.ivamare.ordersession.projection.ProjectionEngine;
import com.ivamare.ordersession.service.AggregateLoader;
import com.ivamare.ordersession.service.CommandResult;
import com.ivamare.ordersession.service.OrderSessionService;
import com.ivamare.ordersession.snapshot.SnapshotPolicy;
import com.ivamare.ordersession.snapshot.SnapshotStore;
import com.ivamare.ordersession.store.AppendResult;
import com.ivamare.ordersession.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Default implementation of OrderSessionService.
 *
 * <p>Holds no session state between calls. Snapshots and projection dispatch
 * happen after the append and never fail the command.
 */
public class DefaultOrderSessionService implements OrderSessionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultOrderSessionService.class);

    private final EventStore eventStore;
    private final AggregateLoader loader;
    private final SnapshotStore snapshotStore;
    private final SnapshotPolicy snapshotPolicy;
    private final ProjectionEngine projectionEngine;
    private final RetryPolicy retryPolicy;
    private final CommandContext context;
    private final Executor snapshotExecutor;
    private final ExecutorService ownedExecutor;

    public DefaultOrderSessionService(
            EventStore eventStore,
            AggregateLoader loader,
            SnapshotStore snapshotStore,
            SnapshotPolicy snapshotPolicy,
            ProjectionEngine projectionEngine,
            RetryPolicy retryPolicy,
            CommandContext context,
            Executor snapshotExecutor) {
        this.eventStore = eventStore;
        this.loader = loader;
        this.snapshotStore = snapshotStore;
        this.snapshotPolicy = snapshotPolicy;
        this.projectionEngine = projectionEngine;
        this.retryPolicy = retryPolicy;
        this.context = context;
        if (snapshotExecutor != null || !snapshotPolicy.isEnabled()) {
            this.ownedExecutor = null;
            this.snapshotExecutor = snapshotExecutor;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, "ordersession-snapshot");
                thread.setDaemon(true);
                return thread;
            });
            this.snapshotExecutor = ownedExecutor;
        }
    }

    // --- Commands ---

    @Override
    public CommandResult initiate(InitiateSession command) {
        UUID sessionId = command.sessionId() != null ? command.sessionId() : context.idGenerator().get();
        return execute(sessionId, command.withSessionId(sessionId));
    }

    @Override
    public CommandResult addItem(UUID sessionId, AddItem command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult removeItem(UUID sessionId, RemoveItem command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult modifyItem(UUID sessionId, ModifyItem command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult enterCustomerInfo(UUID sessionId, EnterCustomerInfo command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult applyDiscount(UUID sessionId, ApplyDiscount command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult recordPayment(UUID sessionId, RecordPayment command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult close(UUID sessionId, CloseSession command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult voidSession(UUID sessionId, VoidSession command) {
        return execute(sessionId, command);
    }

    @Override
    public CommandResult execute(UUID sessionId, SessionCommand command) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId is required");
        }
        String streamId = sessionId.toString();
        int attempt = 1;

        while (true) {
            OrderSessionState state = loader.load(streamId);
            List<SessionEvent> events;
            try {
                events = OrderSession.decide(state, command, context);
            } catch (SessionValidationException e) {
                log.debug("{} rejected for {}: {}", command.name(), streamId, e.getMessage());
                throw e;
            }

            try {
                AppendResult result = eventStore.append(streamId, state.version(), events);
                log.info("{} on {} appended {} events (version {} -> {}, attempt {})",
                    command.name(), streamId, events.size(), state.version(), result.newVersion(), attempt);
                afterAppend(state, result);
                return new CommandResult(sessionId, result.newVersion(), result.events(), attempt);
            } catch (VersionConflictException e) {
                if (!retryPolicy.shouldRetry(attempt)) {
                    log.warn("{} on {} gave up after {} conflicting attempts", command.name(), streamId, attempt);
                    throw new ConcurrencyConflictException(streamId, attempt, e);
                }
                long backoff = retryPolicy.getJitteredBackoff(attempt);
                log.warn("Version conflict on {} for {} (expected {}, actual {}), retrying in {}ms (attempt {}/{})",
                    streamId, command.name(), e.getExpectedVersion(), e.getActualVersion(),
                    backoff, attempt, retryPolicy.maxAttempts());
                if (!pause(backoff)) {
                    log.warn("{} on {} interrupted while backing off after attempt {}", command.name(), streamId, attempt);
                    throw new ConcurrencyConflictException(streamId, attempt, e);
                }
                attempt++;
            }
        }
    }

    // --- Queries ---

    @Override
    public OrderSessionState load(UUID sessionId) {
        return loader.load(sessionId.toString());
    }

    @Override
    public List<StoredEvent> history(UUID sessionId) {
        try (Stream<StoredEvent> events = eventStore.readFrom(sessionId.toString(), 0)) {
            return events.toList();
        }
    }

    /**
     * Stop the snapshot writer if this service created it.
     */
    public void shutdown() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // --- After append ---

    private void afterAppend(OrderSessionState before, AppendResult result) {
        if (projectionEngine != null) {
            projectionEngine.publish(result.events());
        }
        if (snapshotPolicy.shouldSnapshot(result.previousVersion(), result.newVersion())) {
            OrderSessionState after = OrderSession.fold(before, result.events());
            scheduleSnapshot(result.streamId(), after);
        }
    }

    private void scheduleSnapshot(String streamId, OrderSessionState state) {
        try {
            snapshotExecutor.execute(() -> {
                try {
                    snapshotStore.save(streamId, state.version(), state);
                    snapshotStore.prune(streamId, snapshotPolicy.keepLatest());
                } catch (RuntimeException e) {
                    log.warn("Snapshot of {}@{} failed: {}", streamId, state.version(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Snapshot of {}@{} skipped, writer is shut down", streamId, state.version());
        }
    }

    /**
     * @return false if the thread is interrupted, with the interrupt flag kept set
     */
    private boolean pause(long ms) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (ms <= 0) {
            return true;
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

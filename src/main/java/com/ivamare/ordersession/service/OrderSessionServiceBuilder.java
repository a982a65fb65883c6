package com.ivamare.ordersession.service;

import com.ivamare.ordersession.command.CommandContext;
import com.ivamare.ordersession.policy.RetryPolicy;
import com.ivamare.ordersession.pricing.PricingService;
import com.ivamare.ordersession.projection.ProjectionEngine;
import com.ivamare.ordersession.service.impl.DefaultOrderSessionService;
import com.ivamare.ordersession.snapshot.SnapshotPolicy;
import com.ivamare.ordersession.snapshot.SnapshotStore;
import com.ivamare.ordersession.store.EventStore;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Builder for creating OrderSessionService instances.
 */
public class OrderSessionServiceBuilder {

    private EventStore eventStore;
    private SnapshotStore snapshotStore;
    private SnapshotPolicy snapshotPolicy;
    private ProjectionEngine projectionEngine;
    private RetryPolicy retryPolicy;
    private PricingService pricingService;
    private Clock clock = Clock.systemUTC();
    private Supplier<UUID> idGenerator = UUID::randomUUID;
    private Executor snapshotExecutor;

    /**
     * Set the event store. Required.
     *
     * @param eventStore The event store
     * @return this builder
     */
    public OrderSessionServiceBuilder eventStore(EventStore eventStore) {
        this.eventStore = eventStore;
        return this;
    }

    /**
     * Set the snapshot store. Without one, every load is a full replay.
     *
     * @param snapshotStore The snapshot store
     * @return this builder
     */
    public OrderSessionServiceBuilder snapshotStore(SnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
        return this;
    }

    public OrderSessionServiceBuilder snapshotPolicy(SnapshotPolicy snapshotPolicy) {
        this.snapshotPolicy = snapshotPolicy;
        return this;
    }

    /**
     * Set the projection engine that receives appended events.
     *
     * @param projectionEngine The projection engine
     * @return this builder
     */
    public OrderSessionServiceBuilder projectionEngine(ProjectionEngine projectionEngine) {
        this.projectionEngine = projectionEngine;
        return this;
    }

    /**
     * Set the retry policy for version conflicts.
     *
     * @param retryPolicy The retry policy
     * @return this builder
     */
    public OrderSessionServiceBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Set the pricing collaborator. Required.
     *
     * @param pricingService The pricing service
     * @return this builder
     */
    public OrderSessionServiceBuilder pricingService(PricingService pricingService) {
        this.pricingService = pricingService;
        return this;
    }

    public OrderSessionServiceBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public OrderSessionServiceBuilder idGenerator(Supplier<UUID> idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    /**
     * Set the executor that writes snapshots. Defaults to a single background thread.
     *
     * @param snapshotExecutor The executor
     * @return this builder
     */
    public OrderSessionServiceBuilder snapshotExecutor(Executor snapshotExecutor) {
        this.snapshotExecutor = snapshotExecutor;
        return this;
    }

    /**
     * Build the service.
     *
     * @return the configured service
     * @throws IllegalStateException if a required collaborator is missing
     */
    public OrderSessionService build() {
        if (eventStore == null) {
            throw new IllegalStateException("eventStore is required");
        }
        if (pricingService == null) {
            throw new IllegalStateException("pricingService is required");
        }
        if (snapshotPolicy == null) {
            snapshotPolicy = snapshotStore != null ? SnapshotPolicy.every(50) : SnapshotPolicy.never();
        }
        if (snapshotPolicy.isEnabled() && snapshotStore == null) {
            throw new IllegalStateException("snapshotStore is required when snapshots are enabled");
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }

        return new DefaultOrderSessionService(
            eventStore,
            new AggregateLoader(eventStore, snapshotStore),
            snapshotStore,
            snapshotPolicy,
            projectionEngine,
            retryPolicy,
            new CommandContext(pricingService, clock, idGenerator),
            snapshotExecutor
        );
    }
}

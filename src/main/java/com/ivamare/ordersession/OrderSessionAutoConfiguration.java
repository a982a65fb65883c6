package com.ivamare.ordersession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersession.event.SessionEventCodec;
import com.ivamare.ordersession.inventory.InventoryGateway;
import com.ivamare.ordersession.inventory.InventorySubscriber;
import com.ivamare.ordersession.policy.RetryPolicy;
import com.ivamare.ordersession.pricing.PricingService;
import com.ivamare.ordersession.projection.DeadLetterRepository;
import com.ivamare.ordersession.projection.EventSubscriber;
import com.ivamare.ordersession.projection.ProjectionEngine;
import com.ivamare.ordersession.projection.impl.DefaultProjectionEngine;
import com.ivamare.ordersession.projection.impl.InMemoryDeadLetterRepository;
import com.ivamare.ordersession.projection.impl.JdbcDeadLetterRepository;
import com.ivamare.ordersession.projection.view.OpenSessionsProjection;
import com.ivamare.ordersession.projection.view.RevenueLedgerProjection;
import com.ivamare.ordersession.projection.view.SessionSummaryProjection;
import com.ivamare.ordersession.service.OrderSessionService;
import com.ivamare.ordersession.snapshot.SnapshotPolicy;
import com.ivamare.ordersession.snapshot.SnapshotStore;
import com.ivamare.ordersession.snapshot.impl.InMemorySnapshotStore;
import com.ivamare.ordersession.snapshot.impl.JdbcSnapshotStore;
import com.ivamare.ordersession.store.EventStore;
import com.ivamare.ordersession.store.impl.InMemoryEventStore;
import com.ivamare.ordersession.store.impl.JdbcEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for order sessions.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event codec</li>
 *   <li>Event store, snapshot store and dead-letter repository (JDBC or in-memory)</li>
 *   <li>Built-in projections and the projection engine</li>
 *   <li>Inventory subscriber, when an {@link InventoryGateway} bean exists</li>
 *   <li>Order session service, when a {@link PricingService} bean exists</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * ordersession.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "ordersession", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OrderSessionProperties.class)
public class OrderSessionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrderSessionAutoConfiguration.class);

    private static final double PROJECTION_RETRY_JITTER = 0.2;

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper orderSessionObjectMapper() {
        return SessionEventCodec.defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionEventCodec sessionEventCodec(ObjectMapper objectMapper) {
        return new SessionEventCodec(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock orderSessionClock() {
        return Clock.systemUTC();
    }

    // --- JDBC Storage ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ordersession", name = "storage", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(
                DataSource dataSource,
                ObjectProvider<PlatformTransactionManager> transactionManager,
                SessionEventCodec codec,
                Clock clock,
                OrderSessionProperties properties) {
            JdbcTemplate storeTemplate = new JdbcTemplate(dataSource);
            storeTemplate.setQueryTimeout(properties.getStore().getQueryTimeoutSeconds());
            TransactionTemplate transactionTemplate = new TransactionTemplate(
                transactionManager.getIfAvailable(() -> new DataSourceTransactionManager(dataSource)));
            return new JdbcEventStore(storeTemplate, transactionTemplate, codec, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public SnapshotStore snapshotStore(JdbcTemplate jdbcTemplate, SessionEventCodec codec) {
            return new JdbcSnapshotStore(jdbcTemplate, codec.objectMapper());
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterRepository deadLetterRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcDeadLetterRepository(jdbcTemplate);
        }
    }

    // --- In-Memory Storage ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ordersession", name = "storage", havingValue = "memory")
    static class InMemoryStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(Clock clock) {
            return new InMemoryEventStore(clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public SnapshotStore snapshotStore(Clock clock) {
            return new InMemorySnapshotStore(clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public DeadLetterRepository deadLetterRepository() {
            return new InMemoryDeadLetterRepository();
        }
    }

    // --- Snapshot Policy ---

    @Bean
    @ConditionalOnMissingBean
    public SnapshotPolicy snapshotPolicy(OrderSessionProperties properties) {
        OrderSessionProperties.SnapshotProperties snapshot = properties.getSnapshot();
        if (!snapshot.isEnabled()) {
            return SnapshotPolicy.never();
        }
        return new SnapshotPolicy(snapshot.getInterval(), snapshot.getKeepLatest());
    }

    // --- Projections ---

    @Bean
    @ConditionalOnMissingBean
    public OpenSessionsProjection openSessionsProjection() {
        return new OpenSessionsProjection();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionSummaryProjection sessionSummaryProjection() {
        return new SessionSummaryProjection();
    }

    @Bean
    @ConditionalOnMissingBean
    public RevenueLedgerProjection revenueLedgerProjection() {
        return new RevenueLedgerProjection();
    }

    @Bean
    @ConditionalOnBean(InventoryGateway.class)
    @ConditionalOnMissingBean
    public InventorySubscriber inventorySubscriber(InventoryGateway inventoryGateway) {
        return new InventorySubscriber(inventoryGateway);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ProjectionEngine projectionEngine(
            EventStore eventStore,
            ObjectProvider<EventSubscriber> subscribers,
            DeadLetterRepository deadLetterRepository,
            Clock clock,
            OrderSessionProperties properties) {
        OrderSessionProperties.ProjectionProperties projection = properties.getProjection();
        List<EventSubscriber> ordered = subscribers.orderedStream().toList();
        return new DefaultProjectionEngine(
            eventStore,
            ordered,
            deadLetterRepository,
            new RetryPolicy(projection.getMaxAttempts(), projection.getBackoffScheduleMs(), PROJECTION_RETRY_JITTER),
            projection.getConcurrency(),
            projection.getRebuildPageSize(),
            clock
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "ordersession.projection", name = "rebuild-on-startup", havingValue = "true")
    public ApplicationRunner projectionRebuildRunner(ProjectionEngine projectionEngine) {
        return args -> {
            long replayed = projectionEngine.rebuild();
            log.info("Projections rebuilt on startup from {} events", replayed);
        };
    }

    // --- Order Session Service ---

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnBean(PricingService.class)
    @ConditionalOnMissingBean
    public OrderSessionService orderSessionService(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            SnapshotPolicy snapshotPolicy,
            ProjectionEngine projectionEngine,
            PricingService pricingService,
            Clock clock,
            OrderSessionProperties properties) {
        OrderSessionProperties.RetryProperties retry = properties.getCommandRetry();
        return OrderSessionService.builder()
            .eventStore(eventStore)
            .snapshotStore(snapshotStore)
            .snapshotPolicy(snapshotPolicy)
            .projectionEngine(projectionEngine)
            .pricingService(pricingService)
            .clock(clock)
            .retryPolicy(new RetryPolicy(retry.getMaxAttempts(), retry.getBackoffScheduleMs(), retry.getJitter()))
            .build();
    }
}

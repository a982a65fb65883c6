package com.ivamare.ordersession.service.impl;

import com.ivamare.ordersession.SessionFixtures;
import com.ivamare.ordersession.command.AddItem;
import com.ivamare.ordersession.command.ApplyDiscount;
import com.ivamare.ordersession.command.CloseSession;
import com.ivamare.ordersession.command.EnterCustomerInfo;
import com.ivamare.ordersession.command.InitiateSession;
import com.ivamare.ordersession.command.VoidSession;
import com.ivamare.ordersession.event.DiscountApplied;
import com.ivamare.ordersession.event.ItemAdded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.ConcurrencyConflictException;
import com.ivamare.ordersession.exception.SessionValidationException;
import com.ivamare.ordersession.exception.ValidationCode;
import com.ivamare.ordersession.exception.VersionConflictException;
import com.ivamare.ordersession.model.LineModifier;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.SessionStatus;
import com.ivamare.ordersession.model.SessionType;
import com.ivamare.ordersession.policy.RetryPolicy;
import com.ivamare.ordersession.projection.ProjectionEngine;
import com.ivamare.ordersession.service.CommandResult;
import com.ivamare.ordersession.service.OrderSessionService;
import com.ivamare.ordersession.snapshot.SnapshotPolicy;
import com.ivamare.ordersession.snapshot.impl.InMemorySnapshotStore;
import com.ivamare.ordersession.store.AppendResult;
import com.ivamare.ordersession.store.EventStore;
import com.ivamare.ordersession.store.impl.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultOrderSessionService")
class DefaultOrderSessionServiceTest {

    @Mock
    private ProjectionEngine projectionEngine;

    private InMemoryEventStore eventStore;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore(SessionFixtures.CLOCK);
        sessionId = UUID.randomUUID();
    }

    private OrderSessionService service(EventStore store, RetryPolicy retryPolicy) {
        return OrderSessionService.builder()
            .eventStore(store)
            .pricingService(SessionFixtures.TEN_EACH)
            .clock(SessionFixtures.CLOCK)
            .retryPolicy(retryPolicy)
            .build();
    }

    private static List<Class<?>> eventTypes(List<StoredEvent> events) {
        List<Class<?>> types = new ArrayList<>();
        for (StoredEvent event : events) {
            types.add(event.event().getClass());
        }
        return types;
    }

    @Nested
    @DisplayName("commands")
    class CommandTests {

        @Test
        @DisplayName("should run a dine-in session from initiate to close")
        void shouldRunSessionToClose() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());

            service.initiate(SessionFixtures.dineIn(sessionId));
            service.addItem(sessionId, AddItem.of(101L, 2));
            service.applyDiscount(sessionId, ApplyDiscount.sessionPercentage("10"));
            CommandResult closed = service.close(sessionId, CloseSession.withoutTax());

            assertEquals(4, closed.version());
            assertEquals(1, closed.attempts());
            List<StoredEvent> history = service.history(sessionId);
            assertEquals(List.of(SessionInitiated.class, ItemAdded.class, DiscountApplied.class, SessionClosed.class),
                eventTypes(history));

            OrderSessionState state = service.load(sessionId);
            assertEquals(4, state.version());
            assertEquals(SessionStatus.CLOSED, state.status());
            assertEquals(new BigDecimal("20.00"), state.totals().subtotal());
            assertEquals(new BigDecimal("2.00"), state.totals().discountTotal());
            assertEquals(new BigDecimal("18.00"), state.totals().grandTotal());
        }

        @Test
        @DisplayName("should assign a session id when the command has none")
        void shouldGenerateSessionId() {
            UUID generated = UUID.randomUUID();
            OrderSessionService service = OrderSessionService.builder()
                .eventStore(eventStore)
                .pricingService(SessionFixtures.TEN_EACH)
                .idGenerator(() -> generated)
                .build();

            CommandResult result = service.initiate(SessionFixtures.dineIn(null));

            assertEquals(generated, result.sessionId());
            SessionInitiated initiated = (SessionInitiated) result.events().get(0).event();
            assertEquals(generated, initiated.sessionId());
            assertEquals(1, eventStore.currentVersion(generated.toString()));
        }

        @Test
        @DisplayName("should keep metadata entries that have no value")
        void shouldAcceptMetadataWithoutValue() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("customerName", null);
            metadata.put("channel", "phone");

            CommandResult result = service.initiate(
                new InitiateSession(sessionId, 1L, SessionFixtures.LOCATION_ID, SessionType.TAKEOUT, null, 1, metadata));

            assertEquals(1, result.version());
            OrderSessionState state = service.load(sessionId);
            assertTrue(state.metadata().containsKey("customerName"));
            assertNull(state.metadata().get("customerName"));
            assertEquals("phone", state.metadata().get("channel"));
        }

        @Test
        @DisplayName("should record customer details and priced modifiers on a takeout order")
        void shouldTakeTakeoutOrderWithCustomerDetails() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());
            service.initiate(
                new InitiateSession(sessionId, 1L, SessionFixtures.LOCATION_ID, SessionType.TAKEOUT, null, 1, Map.of()));
            List<LineModifier> modifiers = List.of(
                new LineModifier("bacon", new BigDecimal("2.00")),
                new LineModifier("extra cheese", new BigDecimal("1.00")));
            service.addItem(sessionId, new AddItem(4L, null, "Burger", 1, modifiers, null));

            CommandResult result = service.enterCustomerInfo(sessionId,
                new EnterCustomerInfo(Map.of("name", "Ana", "phone", "555-0100"), true));

            assertEquals(3, result.version());
            OrderSessionState state = service.load(sessionId);
            assertEquals("Ana", state.customerInfo().get("name"));
            assertTrue(state.customerInfoComplete());
            assertEquals(new BigDecimal("13.00"), state.totals().subtotal());

            service.voidSession(sessionId, new VoidSession("customer cancelled", null));
            SessionValidationException ex = assertThrows(SessionValidationException.class,
                () -> service.enterCustomerInfo(sessionId, new EnterCustomerInfo(Map.of("name", "Bo"), true)));
            assertEquals(ValidationCode.INVALID_STATE_TRANSITION, ex.getCode());
            assertEquals(4, eventStore.currentVersion(sessionId.toString()));
        }

        @Test
        @DisplayName("should append nothing when a command is rejected")
        void shouldNotAppendRejectedCommand() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());
            service.initiate(SessionFixtures.dineIn(sessionId));

            SessionValidationException ex = assertThrows(SessionValidationException.class,
                () -> service.addItem(sessionId, AddItem.of(1L, -1)));

            assertEquals(ValidationCode.NEGATIVE_QUANTITY, ex.getCode());
            assertEquals(1, eventStore.currentVersion(sessionId.toString()));
        }

        @Test
        @DisplayName("should void by appending one event and refuse to close afterwards")
        void shouldVoidAppendOnly() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());
            service.initiate(SessionFixtures.dineIn(sessionId));
            service.addItem(sessionId, AddItem.of(1L, 1));
            List<StoredEvent> before = service.history(sessionId);

            CommandResult voided = service.voidSession(sessionId, new VoidSession("walked out", "staff-3"));

            assertEquals(1, voided.events().size());
            assertInstanceOf(SessionVoided.class, voided.events().get(0).event());
            assertEquals(before, service.history(sessionId).subList(0, before.size()));

            SessionValidationException ex = assertThrows(SessionValidationException.class,
                () -> service.close(sessionId, CloseSession.withoutTax()));
            assertEquals(ValidationCode.INVALID_STATE_TRANSITION, ex.getCode());
            assertEquals(3, eventStore.currentVersion(sessionId.toString()));
        }

        @Test
        @DisplayName("should reject commands for a session that was never initiated")
        void shouldRejectUnknownSession() {
            OrderSessionService service = service(eventStore, RetryPolicy.defaultPolicy());

            SessionValidationException ex = assertThrows(SessionValidationException.class,
                () -> service.addItem(sessionId, AddItem.of(1L, 1)));

            assertEquals(ValidationCode.SESSION_NOT_FOUND, ex.getCode());
            assertFalse(eventStore.streamExists(sessionId.toString()));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should retry the loser of two concurrent appends against a fresh load")
        void shouldRetryConcurrentAddItem() throws Exception {
            CyclicBarrier barrier = new CyclicBarrier(2);
            EventStore racing = new RendezvousEventStore(eventStore, 2, barrier);
            OrderSessionService service = service(racing, new RetryPolicy(5, List.of(1L), 0));
            service.initiate(SessionFixtures.dineIn(sessionId));
            service.addItem(sessionId, AddItem.of(1L, 1));

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<CommandResult> first = executor.submit(() -> service.addItem(sessionId, AddItem.of(2L, 1)));
                Future<CommandResult> second = executor.submit(() -> service.addItem(sessionId, AddItem.of(3L, 1)));
                CommandResult a = first.get(10, TimeUnit.SECONDS);
                CommandResult b = second.get(10, TimeUnit.SECONDS);

                List<Integer> attempts = new ArrayList<>(List.of(a.attempts(), b.attempts()));
                attempts.sort(Integer::compareTo);
                assertEquals(List.of(1, 2), attempts);
                assertEquals(List.of(3L, 4L), List.of(Math.min(a.version(), b.version()),
                    Math.max(a.version(), b.version())));
            } finally {
                executor.shutdownNow();
            }

            OrderSessionState state = service.load(sessionId);
            assertEquals(4, state.version());
            assertEquals(3, state.lineItems().size());
            assertEquals(new BigDecimal("30.00"), state.totals().subtotal());
        }

        @Test
        @DisplayName("should give up after the retry budget is spent")
        void shouldGiveUpAfterMaxAttempts() {
            EventStore conflicting = mock(EventStore.class);
            when(conflicting.readFrom(eq(sessionId.toString()), anyLong()))
                .thenAnswer(invocation -> SessionFixtures.stored(sessionId.toString(), List.of(initiatedEvent()))
                    .stream());
            when(conflicting.append(eq(sessionId.toString()), eq(1L), anyList()))
                .thenThrow(new VersionConflictException(sessionId.toString(), 1, 2));
            OrderSessionService service = service(conflicting, new RetryPolicy(3, List.of(1L), 0));

            ConcurrencyConflictException ex = assertThrows(ConcurrencyConflictException.class,
                () -> service.addItem(sessionId, AddItem.of(1L, 1)));

            assertEquals(3, ex.getAttempts());
            assertTrue(ex.isRetryable());
            assertInstanceOf(VersionConflictException.class, ex.getCause());
            verify(conflicting, times(3)).append(eq(sessionId.toString()), eq(1L), anyList());
        }

        @Test
        @DisplayName("should stop retrying when interrupted and keep the interrupt flag")
        void shouldStopRetryingWhenInterrupted() {
            EventStore conflicting = mock(EventStore.class);
            when(conflicting.readFrom(eq(sessionId.toString()), anyLong()))
                .thenAnswer(invocation -> SessionFixtures.stored(sessionId.toString(), List.of(initiatedEvent()))
                    .stream());
            when(conflicting.append(eq(sessionId.toString()), eq(1L), anyList()))
                .thenThrow(new VersionConflictException(sessionId.toString(), 1, 2));
            OrderSessionService service = service(conflicting, new RetryPolicy(5, List.of(1000L), 0));

            Thread.currentThread().interrupt();
            ConcurrencyConflictException ex;
            try {
                ex = assertThrows(ConcurrencyConflictException.class,
                    () -> service.addItem(sessionId, AddItem.of(1L, 1)));
            } finally {
                assertTrue(Thread.interrupted());
            }

            assertEquals(1, ex.getAttempts());
            assertInstanceOf(VersionConflictException.class, ex.getCause());
            verify(conflicting, times(1)).append(eq(sessionId.toString()), eq(1L), anyList());
        }

        private SessionEvent initiatedEvent() {
            InitiateSession command = SessionFixtures.dineIn(sessionId);
            return new SessionInitiated(sessionId, command.staffId(), command.locationId(), command.sessionType(),
                command.tableNumber(), command.customerCount(), command.metadata(), SessionFixtures.NOW);
        }
    }

    @Nested
    @DisplayName("after append")
    class AfterAppendTests {

        @Test
        @DisplayName("should publish appended events to the projection engine")
        @SuppressWarnings("unchecked")
        void shouldPublishEvents() {
            when(projectionEngine.publish(anyList())).thenReturn(CompletableFuture.completedFuture(null));
            OrderSessionService service = OrderSessionService.builder()
                .eventStore(eventStore)
                .pricingService(SessionFixtures.TEN_EACH)
                .projectionEngine(projectionEngine)
                .build();

            CommandResult result = service.initiate(SessionFixtures.dineIn(sessionId));

            ArgumentCaptor<List<StoredEvent>> captor = ArgumentCaptor.forClass(List.class);
            verify(projectionEngine).publish(captor.capture());
            assertEquals(result.events(), captor.getValue());
        }

        @Test
        @DisplayName("should snapshot when the stream crosses the interval and prune old ones")
        void shouldSnapshotOnInterval() {
            InMemorySnapshotStore snapshots = new InMemorySnapshotStore(SessionFixtures.CLOCK);
            OrderSessionService service = OrderSessionService.builder()
                .eventStore(eventStore)
                .snapshotStore(snapshots)
                .snapshotPolicy(new SnapshotPolicy(2, 1))
                .snapshotExecutor(Runnable::run)
                .pricingService(SessionFixtures.TEN_EACH)
                .clock(SessionFixtures.CLOCK)
                .build();

            service.initiate(SessionFixtures.dineIn(sessionId));
            service.addItem(sessionId, AddItem.of(1L, 1));
            assertEquals(2, snapshots.loadLatest(sessionId.toString()).orElseThrow().version());

            service.addItem(sessionId, AddItem.of(2L, 1));
            service.addItem(sessionId, AddItem.of(3L, 1));

            String streamId = sessionId.toString();
            assertEquals(1, snapshots.count(streamId));
            assertEquals(4, snapshots.loadLatest(streamId).orElseThrow().version());
            assertEquals(service.load(sessionId), snapshots.loadLatest(streamId).orElseThrow().state());
        }

        @Test
        @DisplayName("should require a snapshot store when snapshots are enabled")
        void shouldRequireSnapshotStore() {
            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> OrderSessionService.builder()
                .eventStore(eventStore)
                .pricingService(SessionFixtures.TEN_EACH)
                .snapshotPolicy(SnapshotPolicy.every(10))
                .build());
            assertTrue(ex.getMessage().contains("snapshotStore"));
        }
    }

    /**
     * Holds appends at one expected version until two callers arrive, so both
     * race from the same loaded state.
     */
    private static final class RendezvousEventStore implements EventStore {

        private final EventStore delegate;
        private final long rendezvousVersion;
        private final CyclicBarrier barrier;

        RendezvousEventStore(EventStore delegate, long rendezvousVersion, CyclicBarrier barrier) {
            this.delegate = delegate;
            this.rendezvousVersion = rendezvousVersion;
            this.barrier = barrier;
        }

        @Override
        public AppendResult append(String streamId, long expectedVersion, List<SessionEvent> events) {
            if (expectedVersion == rendezvousVersion) {
                try {
                    barrier.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                } catch (BrokenBarrierException | TimeoutException e) {
                    throw new IllegalStateException("Second writer never arrived", e);
                }
            }
            return delegate.append(streamId, expectedVersion, events);
        }

        @Override
        public Stream<StoredEvent> readFrom(String streamId, long fromVersionExclusive) {
            return delegate.readFrom(streamId, fromVersionExclusive);
        }

        @Override
        public long currentVersion(String streamId) {
            return delegate.currentVersion(streamId);
        }

        @Override
        public List<StoredEvent> readAll(long afterGlobalPosition, int limit) {
            return delegate.readAll(afterGlobalPosition, limit);
        }
    }
}

package com.ivamare.ordersession.store.impl;

import com.ivamare.ordersession.SessionFixtures;
import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.event.UnknownSessionEvent;
import com.ivamare.ordersession.exception.VersionConflictException;
import com.ivamare.ordersession.store.AppendResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryEventStore")
class InMemoryEventStoreTest {

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(SessionFixtures.CLOCK);
    }

    private static SessionEvent marker(String name) {
        return new UnknownSessionEvent("Marker", Map.of("name", name));
    }

    @Nested
    @DisplayName("append")
    class AppendTests {

        @Test
        @DisplayName("should number events contiguously from the expected version")
        void shouldNumberEvents() {
            store.append("s-1", 0, List.of(marker("a"), marker("b")));

            AppendResult result = store.append("s-1", 2, List.of(marker("c")));

            assertEquals(2, result.previousVersion());
            assertEquals(3, result.newVersion());
            assertEquals(3, result.events().get(0).sequenceNumber());
            assertEquals(SessionFixtures.NOW, result.events().get(0).recordedAt());
            assertEquals(3, store.currentVersion("s-1"));
        }

        @Test
        @DisplayName("should reject a stale expected version and leave the stream unchanged")
        void shouldRejectStaleVersion() {
            store.append("s-1", 0, List.of(marker("a")));

            VersionConflictException ex = assertThrows(VersionConflictException.class,
                () -> store.append("s-1", 0, List.of(marker("b"), marker("c"))));

            assertEquals("s-1", ex.getStreamId());
            assertEquals(0, ex.getExpectedVersion());
            assertEquals(1, ex.getActualVersion());
            assertEquals(1, store.currentVersion("s-1"));
            assertEquals(1, store.readAll(0, 10).size());
        }

        @Test
        @DisplayName("should reject an expected version ahead of the stream")
        void shouldRejectFutureVersion() {
            assertThrows(VersionConflictException.class, () -> store.append("s-1", 3, List.of(marker("a"))));
            assertFalse(store.streamExists("s-1"));
        }

        @Test
        @DisplayName("should reject an empty batch")
        void shouldRejectEmptyBatch() {
            assertThrows(IllegalArgumentException.class, () -> store.append("s-1", 0, List.of()));
        }

        @Test
        @DisplayName("should let exactly one of two racing appends win")
        void shouldAllowOneWinner() throws Exception {
            store.append("s-1", 0, List.of(marker("start")));
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                List<Future<String>> outcomes = new ArrayList<>();
                for (String name : List.of("x", "y")) {
                    Callable<String> task = () -> {
                        start.await();
                        try {
                            store.append("s-1", 1, List.of(marker(name)));
                            return "won";
                        } catch (VersionConflictException e) {
                            return "lost";
                        }
                    };
                    outcomes.add(executor.submit(task));
                }
                start.countDown();

                List<String> results = new ArrayList<>();
                for (Future<String> outcome : outcomes) {
                    results.add(outcome.get(5, TimeUnit.SECONDS));
                }
                assertTrue(results.contains("won"));
                assertTrue(results.contains("lost"));
                assertEquals(2, store.currentVersion("s-1"));
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("read")
    class ReadTests {

        @Test
        @DisplayName("should read a stream after the given version")
        void shouldReadFromVersion() {
            store.append("s-1", 0, List.of(marker("a"), marker("b"), marker("c")));

            try (Stream<StoredEvent> events = store.readFrom("s-1", 1)) {
                assertEquals(List.of(2L, 3L), events.map(StoredEvent::sequenceNumber).toList());
            }
        }

        @Test
        @DisplayName("should read nothing for a missing stream")
        void shouldReadEmptyStream() {
            assertEquals(0, store.readFrom("missing", 0).count());
            assertEquals(0, store.currentVersion("missing"));
        }

        @Test
        @DisplayName("should page all streams in global order")
        void shouldPageGlobally() {
            store.append("s-1", 0, List.of(marker("a")));
            store.append("s-2", 0, List.of(marker("b")));
            store.append("s-1", 1, List.of(new SessionVoided("gone", null, SessionFixtures.NOW)));

            List<StoredEvent> first = store.readAll(0, 2);
            List<StoredEvent> rest = store.readAll(first.get(1).globalPosition(), 2);

            assertEquals(List.of("s-1", "s-2"), first.stream().map(StoredEvent::streamId).toList());
            assertEquals(1, rest.size());
            assertEquals(SessionVoided.TYPE, rest.get(0).type());
            assertEquals(3, rest.get(0).globalPosition());
            assertEquals(2, store.streamCount());
        }
    }
}

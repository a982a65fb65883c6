package com.ivamare.ordersession.projection.view;

import com.ivamare.ordersession.SessionFixtures;
import com.ivamare.ordersession.event.PaymentRecorded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.SessionType;
import com.ivamare.ordersession.model.Totals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RevenueLedgerProjection")
class RevenueLedgerProjectionTest {

    private RevenueLedgerProjection projection;

    @BeforeEach
    void setUp() {
        projection = new RevenueLedgerProjection();
    }

    private void closeSession(long locationId, String grandTotal, String tip, Instant closedAt) {
        UUID sessionId = UUID.randomUUID();
        BigDecimal grand = new BigDecimal(grandTotal);
        List<SessionEvent> events = List.of(
            new SessionInitiated(sessionId, 1L, locationId, SessionType.TAKEOUT, null, 1, Map.of(), closedAt),
            new PaymentRecorded(UUID.randomUUID(), "card", grand, new BigDecimal(tip), null, closedAt),
            new SessionClosed(new Totals(grand, BigDecimal.ZERO, BigDecimal.ZERO, grand), BigDecimal.ZERO,
                null, closedAt)
        );
        for (StoredEvent event : SessionFixtures.stored(sessionId.toString(), events)) {
            projection.handle(event);
        }
    }

    @Test
    @DisplayName("should list closed sessions in close order with their tips")
    void shouldListEntriesInCloseOrder() {
        Instant now = SessionFixtures.NOW;
        closeSession(7L, "30.00", "3", now.plus(Duration.ofMinutes(10)));
        closeSession(7L, "12.50", "0", now);

        List<RevenueLedgerProjection.LedgerEntry> entries = projection.entries();

        assertEquals(2, entries.size());
        assertEquals(new BigDecimal("12.50"), entries.get(0).totals().grandTotal());
        assertEquals(new BigDecimal("3.00"), entries.get(1).tips());
        assertEquals(new BigDecimal("42.50"), projection.grandTotal());
    }

    @Test
    @DisplayName("should total one location over a half-open time range")
    void shouldTotalByLocationAndRange() {
        Instant now = SessionFixtures.NOW;
        closeSession(7L, "10.00", "0", now);
        closeSession(7L, "20.00", "0", now.plus(Duration.ofHours(1)));
        closeSession(8L, "40.00", "0", now.plus(Duration.ofMinutes(30)));

        Totals totals = projection.totalsBetween(7L, now, now.plus(Duration.ofHours(1)));

        assertEquals(new BigDecimal("10.00"), totals.grandTotal());
        assertEquals(new BigDecimal("40.00"),
            projection.totalsBetween(8L, now, now.plus(Duration.ofDays(1))).grandTotal());
    }

    @Test
    @DisplayName("should forget everything on reset")
    void shouldReset() {
        closeSession(7L, "10.00", "1", SessionFixtures.NOW);

        projection.reset();

        assertTrue(projection.entries().isEmpty());
        assertEquals(new BigDecimal("0.00"), projection.grandTotal());
    }
}

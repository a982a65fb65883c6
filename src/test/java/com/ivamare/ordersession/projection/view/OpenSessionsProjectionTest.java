package com.ivamare.ordersession.projection.view;

import com.ivamare.ordersession.SessionFixtures;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.SessionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenSessionsProjection")
class OpenSessionsProjectionTest {

    private OpenSessionsProjection projection;

    @BeforeEach
    void setUp() {
        projection = new OpenSessionsProjection();
    }

    private UUID open(long locationId, Integer table) {
        UUID sessionId = UUID.randomUUID();
        projection.handle(new StoredEvent(sessionId.toString(), 1, 1, null,
            new SessionInitiated(sessionId, 1L, locationId, SessionType.DINE_IN, table, 2, Map.of(),
                SessionFixtures.NOW),
            SessionFixtures.NOW));
        return sessionId;
    }

    @Test
    @DisplayName("should list open sessions per location")
    void shouldListByLocation() {
        UUID table5 = open(7L, 5);
        open(8L, 1);

        List<OpenSessionsProjection.OpenSession> sessions = projection.openSessions(7L);

        assertEquals(1, sessions.size());
        assertEquals(table5, sessions.get(0).sessionId());
        assertEquals(5, sessions.get(0).tableNumber());
        assertEquals(2, projection.count());
    }

    @Test
    @DisplayName("should drop sessions once closed or voided")
    void shouldDropTerminalSessions() {
        UUID closed = open(7L, 1);
        UUID voided = open(7L, 2);
        UUID stillOpen = open(7L, 3);

        projection.handle(new StoredEvent(closed.toString(), 2, 4, null,
            new SessionClosed(null, null, null, SessionFixtures.NOW), SessionFixtures.NOW));
        projection.handle(new StoredEvent(voided.toString(), 2, 5, null,
            new SessionVoided("no show", null, SessionFixtures.NOW), SessionFixtures.NOW));

        assertFalse(projection.isOpen(closed));
        assertFalse(projection.isOpen(voided));
        assertTrue(projection.isOpen(stillOpen));
        assertEquals(1, projection.openSessions(7L).size());
    }
}

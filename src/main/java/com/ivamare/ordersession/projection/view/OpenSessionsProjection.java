package com.ivamare.ordersession.projection.view;

import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.SessionType;
import com.ivamare.ordersession.projection.Projection;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions that are currently open, per location.
 */
public class OpenSessionsProjection implements Projection {

    public static final String NAME = "open-sessions";

    private final Map<String, OpenSession> open = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StoredEvent stored) {
        if (stored.event() instanceof SessionInitiated initiated) {
            open.put(stored.streamId(), new OpenSession(
                initiated.sessionId(),
                initiated.locationId(),
                initiated.sessionType(),
                initiated.tableNumber(),
                initiated.customerCount(),
                initiated.initiatedAt()
            ));
        } else if (stored.event() instanceof SessionClosed || stored.event() instanceof SessionVoided) {
            open.remove(stored.streamId());
        }
    }

    @Override
    public void reset() {
        open.clear();
    }

    public List<OpenSession> openSessions(Long locationId) {
        return open.values().stream()
            .filter(s -> Objects.equals(s.locationId(), locationId))
            .sorted(Comparator.comparing(OpenSession::openedAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    public boolean isOpen(UUID sessionId) {
        return open.containsKey(sessionId.toString());
    }

    public int count() {
        return open.size();
    }

    /**
     * An open session as listed on the floor view.
     */
    public record OpenSession(
        UUID sessionId,
        Long locationId,
        SessionType sessionType,
        Integer tableNumber,
        int customerCount,
        Instant openedAt
    ) {
    }
}

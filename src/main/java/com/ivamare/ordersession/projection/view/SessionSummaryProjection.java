package com.ivamare.ordersession.projection.view;

import com.ivamare.ordersession.aggregate.OrderSession;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.SessionStatus;
import com.ivamare.ordersession.model.Totals;
import com.ivamare.ordersession.projection.Projection;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session summary, folded with the same rules as the aggregate so its
 * totals always agree with a replay.
 */
public class SessionSummaryProjection implements Projection {

    public static final String NAME = "session-summary";

    private final Map<String, OrderSessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StoredEvent event) {
        sessions.compute(event.streamId(), (id, current) ->
            OrderSession.apply(current != null ? current : OrderSessionState.empty(), event));
    }

    @Override
    public void reset() {
        sessions.clear();
    }

    public Optional<SessionSummary> summary(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId.toString())).map(SessionSummary::of);
    }

    public Map<String, SessionSummary> all() {
        Map<String, SessionSummary> copy = new ConcurrentHashMap<>();
        sessions.forEach((id, state) -> copy.put(id, SessionSummary.of(state)));
        return copy;
    }

    /**
     * Read-side view of a session.
     */
    public record SessionSummary(
        UUID sessionId,
        SessionStatus status,
        long version,
        int lineCount,
        Totals totals,
        BigDecimal amountPaid,
        BigDecimal tipTotal
    ) {
        static SessionSummary of(OrderSessionState state) {
            return new SessionSummary(
                state.sessionId(),
                state.status(),
                state.version(),
                state.lineItems().size(),
                state.totals(),
                state.amountPaid(),
                state.tipTotal()
            );
        }
    }
}

package com.ivamare.ordersession.projection.view;

import com.ivamare.ordersession.event.PaymentRecorded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.Totals;
import com.ivamare.ordersession.projection.Projection;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Revenue of closed sessions, ordered by close time.
 */
public class RevenueLedgerProjection implements Projection {

    public static final String NAME = "revenue-ledger";

    private static final Comparator<LedgerKey> KEY_ORDER =
        Comparator.comparing(LedgerKey::closedAt).thenComparing(LedgerKey::streamId);

    private final ConcurrentSkipListMap<LedgerKey, LedgerEntry> ledger = new ConcurrentSkipListMap<>(KEY_ORDER);
    private final Map<String, Long> locations = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> tips = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StoredEvent stored) {
        if (stored.event() instanceof SessionInitiated initiated) {
            locations.put(stored.streamId(), initiated.locationId());
        } else if (stored.event() instanceof PaymentRecorded payment) {
            tips.merge(stored.streamId(), payment.tip(), BigDecimal::add);
        } else if (stored.event() instanceof SessionClosed closed) {
            Instant closedAt = closed.closedAt() != null ? closed.closedAt() : stored.recordedAt();
            ledger.put(new LedgerKey(closedAt, stored.streamId()), new LedgerEntry(
                stored.streamId(),
                locations.get(stored.streamId()),
                closedAt,
                closed.totals(),
                tips.getOrDefault(stored.streamId(), Money.ZERO)
            ));
        }
    }

    @Override
    public void reset() {
        ledger.clear();
        locations.clear();
        tips.clear();
    }

    public List<LedgerEntry> entries() {
        return List.copyOf(ledger.values());
    }

    /**
     * Sum of closed-session totals for a location in {@code [from, to)}.
     */
    public Totals totalsBetween(Long locationId, Instant from, Instant to) {
        BigDecimal subtotal = Money.ZERO;
        BigDecimal discount = Money.ZERO;
        BigDecimal tax = Money.ZERO;
        BigDecimal grand = Money.ZERO;
        for (LedgerEntry entry : ledger.subMap(new LedgerKey(from, ""), new LedgerKey(to, "")).values()) {
            if (!Objects.equals(entry.locationId(), locationId)) {
                continue;
            }
            subtotal = subtotal.add(entry.totals().subtotal());
            discount = discount.add(entry.totals().discountTotal());
            tax = tax.add(entry.totals().taxTotal());
            grand = grand.add(entry.totals().grandTotal());
        }
        return new Totals(subtotal, discount, tax, grand);
    }

    public BigDecimal grandTotal() {
        return ledger.values().stream()
            .map(entry -> entry.totals().grandTotal())
            .reduce(Money.ZERO, BigDecimal::add);
    }

    record LedgerKey(Instant closedAt, String streamId) {
    }

    /**
     * Revenue of one closed session.
     */
    public record LedgerEntry(
        String streamId,
        Long locationId,
        Instant closedAt,
        Totals totals,
        BigDecimal tips
    ) {
    }
}

package com.ivamare.ordersession.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable state of an order session, derived by folding its events.
 *
 * <p>The empty state (before the session is initiated) has version 0 and no status.
 *
 * @param sessionId Session identifier, also the event stream identifier
 * @param staffId Staff member who opened the session
 * @param locationId Restaurant location
 * @param sessionType Dine-in, takeout, delivery or bar
 * @param tableNumber Table for dine-in sessions
 * @param customerCount Number of guests
 * @param status Lifecycle status, null before initiation
 * @param lineItems Ordered lines
 * @param appliedDiscounts Discounts in application order
 * @param payments Recorded payments
 * @param totals Running totals, frozen on close
 * @param version Sequence number of the last applied event
 * @param metadata Free-form session attributes
 * @param customerInfo Customer details entered so far, by field name
 * @param customerInfoComplete Whether the last entry marked the details complete
 * @param openedAt When the session was initiated
 * @param closedAt When the session was closed
 * @param closedBy Who closed the session
 * @param voidedAt When the session was voided
 * @param voidedBy Who voided the session
 * @param voidReason Why the session was voided
 */
public record OrderSessionState(
    UUID sessionId,
    Long staffId,
    Long locationId,
    SessionType sessionType,
    Integer tableNumber,
    int customerCount,
    SessionStatus status,
    List<LineItem> lineItems,
    List<AppliedDiscount> appliedDiscounts,
    List<Payment> payments,
    Totals totals,
    long version,
    Map<String, Object> metadata,
    Map<String, String> customerInfo,
    boolean customerInfoComplete,
    Instant openedAt,
    Instant closedAt,
    String closedBy,
    Instant voidedAt,
    String voidedBy,
    String voidReason
) {
    private static final OrderSessionState EMPTY = new Builder().build();

    public OrderSessionState {
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
        appliedDiscounts = appliedDiscounts != null ? List.copyOf(appliedDiscounts) : List.of();
        payments = payments != null ? List.copyOf(payments) : List.of();
        totals = totals != null ? totals : Totals.ZERO;
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        customerInfo = customerInfo != null ? Collections.unmodifiableMap(new LinkedHashMap<>(customerInfo)) : Map.of();
    }

    public static OrderSessionState empty() {
        return EMPTY;
    }

    /**
     * Whether the session has been initiated.
     */
    public boolean exists() {
        return status != null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public Optional<LineItem> findLine(UUID lineId) {
        return lineItems.stream()
            .filter(line -> line.lineId().equals(lineId))
            .findFirst();
    }

    public BigDecimal amountPaid() {
        return payments.stream()
            .map(Payment::amount)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    public BigDecimal tipTotal() {
        return payments.stream()
            .map(Payment::tip)
            .reduce(Money.ZERO, BigDecimal::add);
    }

    /**
     * Grand total minus payments; negative when overpaid.
     */
    public BigDecimal balanceDue() {
        return totals.grandTotal().subtract(amountPaid());
    }

    /**
     * Recompute running totals from lines and discounts, without tax.
     */
    public OrderSessionState recalculated() {
        return toBuilder()
            .totals(Totals.calculate(lineItems, appliedDiscounts, BigDecimal.ZERO))
            .build();
    }

    public OrderSessionState withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .sessionId(sessionId)
            .staffId(staffId)
            .locationId(locationId)
            .sessionType(sessionType)
            .tableNumber(tableNumber)
            .customerCount(customerCount)
            .status(status)
            .lineItems(lineItems)
            .appliedDiscounts(appliedDiscounts)
            .payments(payments)
            .totals(totals)
            .version(version)
            .metadata(metadata)
            .customerInfo(customerInfo)
            .customerInfoComplete(customerInfoComplete)
            .openedAt(openedAt)
            .closedAt(closedAt)
            .closedBy(closedBy)
            .voidedAt(voidedAt)
            .voidedBy(voidedBy)
            .voidReason(voidReason);
    }

    /**
     * Builder used by events to derive the next state.
     */
    public static final class Builder {
        private UUID sessionId;
        private Long staffId;
        private Long locationId;
        private SessionType sessionType;
        private Integer tableNumber;
        private int customerCount;
        private SessionStatus status;
        private List<LineItem> lineItems = List.of();
        private List<AppliedDiscount> appliedDiscounts = List.of();
        private List<Payment> payments = List.of();
        private Totals totals = Totals.ZERO;
        private long version;
        private Map<String, Object> metadata = Map.of();
        private Map<String, String> customerInfo = Map.of();
        private boolean customerInfoComplete;
        private Instant openedAt;
        private Instant closedAt;
        private String closedBy;
        private Instant voidedAt;
        private String voidedBy;
        private String voidReason;

        public Builder sessionId(UUID sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder staffId(Long staffId) {
            this.staffId = staffId;
            return this;
        }

        public Builder locationId(Long locationId) {
            this.locationId = locationId;
            return this;
        }

        public Builder sessionType(SessionType sessionType) {
            this.sessionType = sessionType;
            return this;
        }

        public Builder tableNumber(Integer tableNumber) {
            this.tableNumber = tableNumber;
            return this;
        }

        public Builder customerCount(int customerCount) {
            this.customerCount = customerCount;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder lineItems(List<LineItem> lineItems) {
            this.lineItems = lineItems;
            return this;
        }

        public Builder appliedDiscounts(List<AppliedDiscount> appliedDiscounts) {
            this.appliedDiscounts = appliedDiscounts;
            return this;
        }

        public Builder payments(List<Payment> payments) {
            this.payments = payments;
            return this;
        }

        public Builder totals(Totals totals) {
            this.totals = totals;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder customerInfo(Map<String, String> customerInfo) {
            this.customerInfo = customerInfo;
            return this;
        }

        public Builder customerInfoComplete(boolean customerInfoComplete) {
            this.customerInfoComplete = customerInfoComplete;
            return this;
        }

        public Builder openedAt(Instant openedAt) {
            this.openedAt = openedAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder closedBy(String closedBy) {
            this.closedBy = closedBy;
            return this;
        }

        public Builder voidedAt(Instant voidedAt) {
            this.voidedAt = voidedAt;
            return this;
        }

        public Builder voidedBy(String voidedBy) {
            this.voidedBy = voidedBy;
            return this;
        }

        public Builder voidReason(String voidReason) {
            this.voidReason = voidReason;
            return this;
        }

        public OrderSessionState build() {
            return new OrderSessionState(
                sessionId, staffId, locationId, sessionType, tableNumber, customerCount, status,
                lineItems, appliedDiscounts, payments, totals, version, metadata, customerInfo, customerInfoComplete,
                openedAt, closedAt, closedBy, voidedAt, voidedBy, voidReason
            );
        }
    }
}

package com.ivamare.ordersession.aggregate;

import com.ivamare.ordersession.command.AddItem;
import com.ivamare.ordersession.command.ApplyDiscount;
import com.ivamare.ordersession.command.CloseSession;
import com.ivamare.ordersession.command.CommandContext;
import com.ivamare.ordersession.command.EnterCustomerInfo;
import com.ivamare.ordersession.command.InitiateSession;
import com.ivamare.ordersession.command.ModifyItem;
import com.ivamare.ordersession.command.RecordPayment;
import com.ivamare.ordersession.command.RemoveItem;
import com.ivamare.ordersession.command.SessionCommand;
import com.ivamare.ordersession.command.VoidSession;
import com.ivamare.ordersession.event.CustomerInfoEntered;
import com.ivamare.ordersession.event.DiscountApplied;
import com.ivamare.ordersession.event.ItemAdded;
import com.ivamare.ordersession.event.ItemModified;
import com.ivamare.ordersession.event.ItemRemoved;
import com.ivamare.ordersession.event.PaymentRecorded;
import com.ivamare.ordersession.event.SessionClosed;
import com.ivamare.ordersession.event.SessionEvent;
import com.ivamare.ordersession.event.SessionInitiated;
import com.ivamare.ordersession.event.SessionVoided;
import com.ivamare.ordersession.event.StoredEvent;
import com.ivamare.ordersession.exception.SessionValidationException;
import com.ivamare.ordersession.exception.ValidationCode;
import com.ivamare.ordersession.model.DiscountKind;
import com.ivamare.ordersession.model.DiscountScope;
import com.ivamare.ordersession.model.LineItem;
import com.ivamare.ordersession.model.LineModifier;
import com.ivamare.ordersession.model.Money;
import com.ivamare.ordersession.model.OrderSessionState;
import com.ivamare.ordersession.model.Totals;
import com.ivamare.ordersession.pricing.PriceQuote;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * The order session aggregate: pure functions over {@link OrderSessionState}.
 *
 * <p>{@link #apply} and {@link #fold} rebuild state from events and never fail on a
 * well-formed stream. {@link #decide} validates a command against the current state
 * and returns the events to append, or throws {@link SessionValidationException}
 * without producing anything.
 */
public final class OrderSession {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private OrderSession() {
        // Utility class - no instantiation
    }

    // --- Event application ---

    /**
     * Apply one stored event. The resulting version is the event's sequence number.
     *
     * @param state state before the event
     * @param stored the event
     * @return state after the event
     */
    public static OrderSessionState apply(OrderSessionState state, StoredEvent stored) {
        return stored.event().applyTo(state).withVersion(stored.sequenceNumber());
    }

    /**
     * Fold events onto a state, in order.
     *
     * @param state starting state, {@link OrderSessionState#empty()} or a snapshot
     * @param events events following the state's version, contiguous and ordered
     * @return the folded state
     * @throws IllegalStateException if the events do not continue the state's version
     */
    public static OrderSessionState fold(OrderSessionState state, Iterable<StoredEvent> events) {
        return fold(state, events.iterator());
    }

    public static OrderSessionState fold(OrderSessionState state, Stream<StoredEvent> events) {
        return fold(state, events.iterator());
    }

    private static OrderSessionState fold(OrderSessionState state, Iterator<StoredEvent> events) {
        OrderSessionState current = state;
        while (events.hasNext()) {
            StoredEvent next = events.next();
            if (next.sequenceNumber() != current.version() + 1) {
                throw new IllegalStateException("Event " + next.streamId() + "#" + next.sequenceNumber()
                    + " does not follow version " + current.version());
            }
            current = apply(current, next);
        }
        return current;
    }

    // --- Command handling ---

    /**
     * Decide which events a command produces.
     *
     * @param state current state (empty when the stream does not exist)
     * @param command the command
     * @param context pricing, clock and id generation
     * @return events to append, never empty
     * @throws SessionValidationException if the command violates an invariant
     */
    public static List<SessionEvent> decide(OrderSessionState state, SessionCommand command, CommandContext context) {
        if (command instanceof InitiateSession initiate) {
            return List.of(initiate(state, initiate, context));
        }

        requireOpen(state, command);

        if (command instanceof AddItem addItem) {
            return List.of(addItem(state, addItem, context));
        } else if (command instanceof RemoveItem removeItem) {
            return List.of(removeItem(state, removeItem, context));
        } else if (command instanceof ModifyItem modifyItem) {
            return List.of(modifyItem(state, modifyItem, context));
        } else if (command instanceof EnterCustomerInfo enterCustomerInfo) {
            return List.of(enterCustomerInfo(enterCustomerInfo, context));
        } else if (command instanceof ApplyDiscount applyDiscount) {
            return List.of(applyDiscount(state, applyDiscount, context));
        } else if (command instanceof RecordPayment recordPayment) {
            return List.of(recordPayment(recordPayment, context));
        } else if (command instanceof CloseSession closeSession) {
            return List.of(close(state, closeSession, context));
        } else if (command instanceof VoidSession voidSession) {
            return List.of(voidSession(voidSession, context));
        }
        throw new IllegalArgumentException("Unsupported command: " + command.name());
    }

    private static SessionInitiated initiate(OrderSessionState state, InitiateSession cmd, CommandContext context) {
        if (state.isTerminal()) {
            throw new SessionValidationException(ValidationCode.INVALID_STATE_TRANSITION,
                "Session " + state.sessionId() + " is " + state.status(),
                Map.of("status", state.status().getValue()));
        }
        if (state.version() > 0) {
            throw new SessionValidationException(ValidationCode.SESSION_ALREADY_EXISTS,
                "Session " + state.sessionId() + " already exists",
                Map.of("version", state.version()));
        }
        if (cmd.sessionId() == null) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (cmd.locationId() == null) {
            throw new SessionValidationException(ValidationCode.MISSING_LOCATION, "locationId is required");
        }
        if (cmd.sessionType() == null) {
            throw new SessionValidationException(ValidationCode.MISSING_SESSION_TYPE, "sessionType is required");
        }
        if (cmd.customerCount() < 1) {
            throw new SessionValidationException(ValidationCode.INVALID_CUSTOMER_COUNT,
                "customerCount must be at least 1", Map.of("customerCount", cmd.customerCount()));
        }
        if (cmd.tableNumber() != null && cmd.tableNumber() < 1) {
            throw new SessionValidationException(ValidationCode.INVALID_TABLE_NUMBER,
                "tableNumber must be positive", Map.of("tableNumber", cmd.tableNumber()));
        }
        return new SessionInitiated(
            cmd.sessionId(),
            cmd.staffId(),
            cmd.locationId(),
            cmd.sessionType(),
            cmd.tableNumber(),
            cmd.customerCount(),
            cmd.metadata(),
            now(context)
        );
    }

    private static ItemAdded addItem(OrderSessionState state, AddItem cmd, CommandContext context) {
        requirePositiveQuantity(cmd.quantity());
        for (LineModifier modifier : cmd.modifiers()) {
            if (modifier.name() == null || modifier.name().isBlank()) {
                throw new SessionValidationException(ValidationCode.INVALID_MODIFIER, "Modifier name is required");
            }
            if (modifier.price().signum() < 0) {
                throw new SessionValidationException(ValidationCode.INVALID_MODIFIER,
                    "Modifier price cannot be negative",
                    Map.of("modifier", modifier.name(), "price", modifier.price().toPlainString()));
            }
        }
        Instant now = now(context);
        PriceQuote quote = quote(state, cmd.itemId(), cmd.variantId(), cmd.quantity(), now, context);
        return new ItemAdded(
            context.idGenerator().get(),
            cmd.itemId(),
            cmd.variantId(),
            cmd.itemName(),
            cmd.quantity(),
            quote.unitPrice(),
            cmd.modifiers(),
            quote.appliedRuleIds(),
            cmd.notes(),
            now
        );
    }

    private static ItemRemoved removeItem(OrderSessionState state, RemoveItem cmd, CommandContext context) {
        requireLine(state, cmd.lineId());
        return new ItemRemoved(cmd.lineId(), cmd.reason(), now(context));
    }

    private static ItemModified modifyItem(OrderSessionState state, ModifyItem cmd, CommandContext context) {
        LineItem line = requireLine(state, cmd.lineId());
        requirePositiveQuantity(cmd.quantity());
        Instant now = now(context);
        PriceQuote quote = quote(state, line.itemId(), line.variantId(), cmd.quantity(), now, context);
        return new ItemModified(
            line.lineId(),
            cmd.quantity(),
            quote.unitPrice(),
            quote.appliedRuleIds(),
            cmd.notes(),
            now
        );
    }

    private static CustomerInfoEntered enterCustomerInfo(EnterCustomerInfo cmd, CommandContext context) {
        if (cmd.fields().isEmpty()) {
            throw new SessionValidationException(ValidationCode.INVALID_CUSTOMER_INFO,
                "At least one customer field is required");
        }
        for (String field : cmd.fields().keySet()) {
            if (field == null || field.isBlank()) {
                throw new SessionValidationException(ValidationCode.INVALID_CUSTOMER_INFO,
                    "Customer field names cannot be blank");
            }
        }
        return new CustomerInfoEntered(cmd.fields(), cmd.complete(), now(context));
    }

    private static DiscountApplied applyDiscount(OrderSessionState state, ApplyDiscount cmd, CommandContext context) {
        if (cmd.kind() == null) {
            throw new SessionValidationException(ValidationCode.INVALID_DISCOUNT, "kind is required");
        }
        if (!Money.isPositive(cmd.value())) {
            throw new SessionValidationException(ValidationCode.INVALID_DISCOUNT,
                "Discount value must be positive", Map.of("value", String.valueOf(cmd.value())));
        }
        if (cmd.kind() == DiscountKind.PERCENTAGE && cmd.value().compareTo(HUNDRED) > 0) {
            throw new SessionValidationException(ValidationCode.INVALID_DISCOUNT,
                "Percentage discount cannot exceed 100", Map.of("value", cmd.value().toPlainString()));
        }
        if (cmd.scope() == DiscountScope.LINE) {
            if (cmd.lineId() == null) {
                throw new SessionValidationException(ValidationCode.INVALID_DISCOUNT,
                    "Line discount requires a lineId");
            }
            requireLine(state, cmd.lineId());
        }
        return new DiscountApplied(
            context.idGenerator().get(),
            cmd.kind(),
            cmd.value(),
            cmd.scope(),
            cmd.scope() == DiscountScope.LINE ? cmd.lineId() : null,
            cmd.reason(),
            now(context)
        );
    }

    private static PaymentRecorded recordPayment(RecordPayment cmd, CommandContext context) {
        if (cmd.method() == null || cmd.method().isBlank()) {
            throw new SessionValidationException(ValidationCode.INVALID_PAYMENT, "Payment method is required");
        }
        if (!Money.isPositive(cmd.amount())) {
            throw new SessionValidationException(ValidationCode.INVALID_PAYMENT,
                "Payment amount must be positive", Map.of("amount", String.valueOf(cmd.amount())));
        }
        if (cmd.tip() != null && cmd.tip().signum() < 0) {
            throw new SessionValidationException(ValidationCode.INVALID_PAYMENT,
                "Tip cannot be negative", Map.of("tip", cmd.tip().toPlainString()));
        }
        return new PaymentRecorded(
            context.idGenerator().get(),
            cmd.method(),
            cmd.amount(),
            cmd.tip(),
            cmd.reference(),
            now(context)
        );
    }

    private static SessionClosed close(OrderSessionState state, CloseSession cmd, CommandContext context) {
        BigDecimal taxRate = cmd.taxRate() != null ? cmd.taxRate() : BigDecimal.ZERO;
        if (taxRate.signum() < 0) {
            throw new SessionValidationException(ValidationCode.INVALID_TAX_RATE,
                "Tax rate cannot be negative", Map.of("taxRate", taxRate.toPlainString()));
        }
        Totals frozen = Totals.calculate(state.lineItems(), state.appliedDiscounts(), taxRate);
        return new SessionClosed(frozen, taxRate, cmd.closedBy(), now(context));
    }

    private static SessionVoided voidSession(VoidSession cmd, CommandContext context) {
        if (cmd.reason() == null || cmd.reason().isBlank()) {
            throw new SessionValidationException(ValidationCode.MISSING_REASON, "A void reason is required");
        }
        return new SessionVoided(cmd.reason(), cmd.voidedBy(), now(context));
    }

    // --- Guards ---

    private static void requireOpen(OrderSessionState state, SessionCommand command) {
        if (!state.exists()) {
            throw new SessionValidationException(ValidationCode.SESSION_NOT_FOUND,
                command.name() + " requires an initiated session");
        }
        if (state.isTerminal()) {
            throw new SessionValidationException(ValidationCode.INVALID_STATE_TRANSITION,
                command.name() + " not allowed on a " + state.status() + " session",
                Map.of("sessionId", String.valueOf(state.sessionId()), "status", state.status().getValue()));
        }
    }

    private static LineItem requireLine(OrderSessionState state, UUID lineId) {
        if (lineId == null) {
            throw new SessionValidationException(ValidationCode.UNKNOWN_LINE_ITEM, "lineId is required");
        }
        return state.findLine(lineId)
            .orElseThrow(() -> new SessionValidationException(ValidationCode.UNKNOWN_LINE_ITEM,
                "No line " + lineId + " in session " + state.sessionId(),
                Map.of("lineId", lineId.toString())));
    }

    private static void requirePositiveQuantity(int quantity) {
        if (quantity <= 0) {
            throw new SessionValidationException(ValidationCode.NEGATIVE_QUANTITY,
                "Quantity must be positive", Map.of("quantity", quantity));
        }
    }

    private static PriceQuote quote(OrderSessionState state, Long itemId, Long variantId, int quantity,
                                    Instant asOf, CommandContext context) {
        PriceQuote quote;
        try {
            quote = context.pricing().priceForLine(itemId, variantId, state.locationId(), quantity, asOf);
        } catch (RuntimeException e) {
            throw new SessionValidationException(ValidationCode.PRICING_UNAVAILABLE,
                "Pricing failed for item " + itemId + ": " + e.getMessage(),
                Map.of("itemId", String.valueOf(itemId)));
        }
        if (quote == null) {
            throw new SessionValidationException(ValidationCode.PRICING_UNAVAILABLE,
                "No price for item " + itemId, Map.of("itemId", String.valueOf(itemId)));
        }
        return quote;
    }

    private static Instant now(CommandContext context) {
        return context.clock().instant();
    }
}

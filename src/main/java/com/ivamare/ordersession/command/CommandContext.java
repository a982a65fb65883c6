package com.ivamare.ordersession.command;

import com.ivamare.ordersession.pricing.PricingService;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Non-deterministic inputs available while deciding on a command.
 * Whatever is drawn from here ends up in the emitted event payload.
 *
 * @param pricing Pricing collaborator
 * @param clock Source of event timestamps
 * @param idGenerator Source of line, discount and payment identifiers
 */
public record CommandContext(
    PricingService pricing,
    Clock clock,
    Supplier<UUID> idGenerator
) {
    public CommandContext {
        if (pricing == null) {
            throw new IllegalArgumentException("pricing is required");
        }
        clock = clock != null ? clock : Clock.systemUTC();
        idGenerator = idGenerator != null ? idGenerator : UUID::randomUUID;
    }

    public static CommandContext of(PricingService pricing) {
        return new CommandContext(pricing, Clock.systemUTC(), UUID::randomUUID);
    }
}

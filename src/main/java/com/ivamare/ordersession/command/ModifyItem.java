package com.ivamare.ordersession.command;

import java.util.UUID;

/**
 * Change the quantity (and optionally notes) of a line; the line is re-priced.
 */
public record ModifyItem(UUID lineId, int quantity, String notes) implements SessionCommand {
}

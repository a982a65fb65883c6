package com.ivamare.ordersession.command;

import java.util.UUID;

public record RemoveItem(UUID lineId, String reason) implements SessionCommand {
}

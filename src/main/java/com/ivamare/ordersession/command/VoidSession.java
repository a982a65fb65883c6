package com.ivamare.ordersession.command;

public record VoidSession(String reason, String voidedBy) implements SessionCommand {
}

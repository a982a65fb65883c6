package com.ivamare.ordersession.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enter or correct customer details (name, phone, delivery address) on an open session.
 */
public record EnterCustomerInfo(Map<String, String> fields, boolean complete) implements SessionCommand {

    public EnterCustomerInfo {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }
}

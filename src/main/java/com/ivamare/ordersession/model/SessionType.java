package com.ivamare.ordersession.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the guests are served.
 */
public enum SessionType {
    DINE_IN("dine_in"),
    TAKEOUT("takeout"),
    DELIVERY("delivery"),
    BAR("bar");

    private final String value;

    SessionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SessionType fromValue(String value) {
        for (SessionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown SessionType: " + value);
    }
}

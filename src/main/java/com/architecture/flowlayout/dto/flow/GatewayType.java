package com.architecture.flowlayout.dto.flow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Decision semantics of a gateway node.
 */
public enum GatewayType {
    EXCLUSIVE("exclusive"),
    PARALLEL("parallel"),
    INCLUSIVE("inclusive");

    private final String value;

    GatewayType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from a string, case-insensitive.
     * Unknown or missing values fall back to EXCLUSIVE.
     */
    @JsonCreator
    public static GatewayType fromString(String value) {
        if (value == null) return EXCLUSIVE;
        for (GatewayType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return EXCLUSIVE;
    }
}

package com.namingtool.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How to react when a generated name already exists in the external namespace.
 */
public enum ConflictStrategy {
    FAIL("fail"),
    NOTIFY_ONLY("notify-only"),
    AUTO_INCREMENT("auto-increment"),
    SUFFIX_RANDOM("suffix-random");

    private final String value;

    ConflictStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConflictStrategy fromValue(String value) {
        for (ConflictStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown ConflictStrategy: " + value);
    }
}

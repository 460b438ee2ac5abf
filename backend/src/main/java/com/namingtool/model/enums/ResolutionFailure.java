package com.namingtool.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a conflict resolution ended the way it did. {@link #NONE} for successful outcomes.
 */
public enum ResolutionFailure {
    NONE("none"),
    CONFLICT("conflict"),
    NO_INSTANCE_PATTERN("no_instance_pattern"),
    EXHAUSTED("exhausted"),
    ORACLE_FAILURE("oracle_failure"),
    CANCELLED("cancelled"),
    ERROR("error");

    private final String value;

    ResolutionFailure(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ResolutionFailure fromValue(String value) {
        for (ResolutionFailure failure : values()) {
            if (failure.value.equals(value)) {
                return failure;
            }
        }
        throw new IllegalArgumentException("Unknown ResolutionFailure: " + value);
    }
}

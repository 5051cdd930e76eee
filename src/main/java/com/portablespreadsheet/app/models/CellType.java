package com.portablespreadsheet.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * VALUE_ONLY cells hold a constant; COMPUTATIONAL cells were built by an operation.
 */
public enum CellType {
    VALUE_ONLY,
    COMPUTATIONAL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    /**
     * Allows case-insensitive JSON input.
     */
    @JsonCreator
    public static CellType fromValue(String value) {
        return CellType.valueOf(value.toUpperCase());
    }
}

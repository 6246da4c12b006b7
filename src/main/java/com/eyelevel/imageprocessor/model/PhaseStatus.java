package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Status carried by a checkpoint record. Serialized in lower case.
 */
public enum PhaseStatus {
    STARTED("started"),
    COMPLETED("completed"),
    ERROR("error");

    private final String value;

    PhaseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PhaseStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase status: " + value));
    }
}

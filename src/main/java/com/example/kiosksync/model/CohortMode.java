package com.example.kiosksync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CohortMode {
    PRACTICE,
    GRADED,
    COMPETITIVE,
    SIMULATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CohortMode fromWire(String value) {
        return value == null ? null : CohortMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

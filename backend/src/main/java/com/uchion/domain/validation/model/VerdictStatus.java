package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerdictStatus {
    OK,
    WARNING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of an oracle-provided status. Anything unrecognised counts as {@link #OK}.
     */
    public static VerdictStatus parse(String value) {
        if (value == null) return OK;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            default -> OK;
        };
    }
}

package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Content domain of a worksheet. Drives judge instructions, model routing and remediation policy.
 */
public enum Subject {
    MATH("math", "Математика", true),
    ALGEBRA("algebra", "Алгебра", true),
    GEOMETRY("geometry", "Геометрия", true),
    RUSSIAN("russian", "Русский язык", false);

    private final String wireName;
    private final String displayName;
    private final boolean stem;

    Subject(String wireName, String displayName, boolean stem) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.stem = stem;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isStem() {
        return stem;
    }

    @JsonCreator
    public static Subject fromWireName(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown subject: " + value));
    }
}

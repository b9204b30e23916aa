package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Difficulty {
    EASY("easy", "Базовый"),
    MEDIUM("medium", "Средний"),
    HARD("hard", "Повышенный");

    private final String wireName;
    private final String displayName;

    Difficulty(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static Difficulty fromWireName(String value) {
        return Arrays.stream(values())
                .filter(d -> d.wireName.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown difficulty: " + value));
    }
}

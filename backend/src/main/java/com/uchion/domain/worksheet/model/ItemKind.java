package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ItemKind {
    SINGLE_CHOICE("single_choice"),
    MULTIPLE_CHOICE("multiple_choice"),
    OPEN_QUESTION("open_question"),
    MATCHING("matching"),
    FILL_BLANK("fill_blank");

    private final String wireName;

    ItemKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

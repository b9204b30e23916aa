package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SingleChoiceItem(
        String question,
        List<String> options,
        Integer correctIndex,
        String explanation
) implements GeneratedItem {

    @Override
    public ItemKind kind() {
        return ItemKind.SINGLE_CHOICE;
    }

    @Override
    public String promptText() {
        return question;
    }
}

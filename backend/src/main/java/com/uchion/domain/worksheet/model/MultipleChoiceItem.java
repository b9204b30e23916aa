package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MultipleChoiceItem(
        String question,
        List<String> options,
        List<Integer> correctIndices,
        String explanation
) implements GeneratedItem {

    @Override
    public ItemKind kind() {
        return ItemKind.MULTIPLE_CHOICE;
    }

    @Override
    public String promptText() {
        return question;
    }
}

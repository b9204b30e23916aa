package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FillBlankItem(
        String textWithBlanks,
        List<Blank> blanks
) implements GeneratedItem {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Blank(int position, String correctAnswer, List<String> acceptableVariants) {}

    @Override
    public ItemKind kind() {
        return ItemKind.FILL_BLANK;
    }

    @Override
    public String promptText() {
        return textWithBlanks;
    }
}

package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenQuestionItem(
        String question,
        String correctAnswer,
        List<String> acceptableVariants,
        String explanation
) implements GeneratedItem {

    @Override
    public ItemKind kind() {
        return ItemKind.OPEN_QUESTION;
    }

    @Override
    public String promptText() {
        return question;
    }
}

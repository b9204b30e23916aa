package com.uchion.domain.worksheet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Two-column matching exercise.
 *
 * @param correctPairs pairs of {@code [leftIndex, rightIndex]}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchingItem(
        String instruction,
        List<String> leftColumn,
        List<String> rightColumn,
        List<List<Integer>> correctPairs
) implements GeneratedItem {

    @Override
    public ItemKind kind() {
        return ItemKind.MATCHING;
    }

    @Override
    public String promptText() {
        return instruction;
    }
}

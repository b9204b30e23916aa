package com.uchion.support;

import com.uchion.domain.worksheet.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Worksheet fixtures shared by the pipeline tests.
 */
public final class TestItems {

    public static final DomainContext MATH_5 =
            new DomainContext(Subject.MATH, 5, "Обыкновенные дроби", Difficulty.MEDIUM);

    private TestItems() {
    }

    public static SingleChoiceItem singleChoice(String question, int correctIndex) {
        return new SingleChoiceItem(question, List.of("1/2", "1/3", "2/3", "3/4"), correctIndex, null);
    }

    public static OpenQuestionItem openQuestion(String question, String answer) {
        return new OpenQuestionItem(question, answer, List.of(), null);
    }

    /**
     * Structurally valid batch of {@code n} distinct single-choice items.
     */
    public static List<GeneratedItem> batch(int n) {
        List<GeneratedItem> items = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            items.add(singleChoice("Какая дробь больше в задании номер " + i + "?", i % 4));
        }
        return items;
    }
}

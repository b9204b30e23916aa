package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.worksheet.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ItemPromptFormatterTest {

    private ItemPromptFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ItemPromptFormatter();
    }

    @Test
    @DisplayName("answers are shown only when asked for")
    void answersOnlyWhenRequested() {
        SingleChoiceItem item = new SingleChoiceItem("Сколько будет 7 * 8?", List.of("54", "56", "58", "64"), 1, null);

        String withAnswers = formatter.format(item, 3, true);
        String withoutAnswers = formatter.format(item, 3, false);

        assertThat(withAnswers)
                .startsWith("--- Задание 3 (тип: single_choice) ---")
                .contains("Сколько будет 7 * 8?")
                .contains("Указанный правильный ответ: вариант 1 (56)");
        assertThat(withoutAnswers)
                .contains("Сколько будет 7 * 8?")
                .doesNotContain("Указанный");
    }

    @Test
    @DisplayName("batch blocks are numbered by position")
    void batchNumbering() {
        List<GeneratedItem> items = List.of(
                new OpenQuestionItem("Найдите корень уравнения x + 3 = 10", "7", List.of(), null),
                new MatchingItem("Соотнесите слово и часть речи", List.of("бежать"), List.of("глагол"),
                        List.of(List.of(0, 0))));

        String batch = formatter.formatBatch(items, true);

        assertThat(batch)
                .contains("--- Задание 0 (тип: open_question) ---")
                .contains("Указанный ответ: 7")
                .contains("--- Задание 1 (тип: matching) ---")
                .contains("Указанные пары: 0-0");
    }

    @Test
    @DisplayName("out-of-range answer index does not break formatting")
    void outOfRangeIndex() {
        SingleChoiceItem item = new SingleChoiceItem("Сколько будет 7 * 8?", List.of("54", "56"), 9, null);

        assertThat(formatter.format(item, 0, true)).contains("вариант 9");
    }
}

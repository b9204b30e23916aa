package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.worksheet.model.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Renders items into the plain-text blocks judges read.
 * The answer judge sees stated answers; the quality judge sees only what the pupil sees.
 */
@Component
public class ItemPromptFormatter {

    public String formatBatch(List<GeneratedItem> items, boolean withAnswers) {
        return IntStream.range(0, items.size())
                .mapToObj(i -> format(items.get(i), i, withAnswers))
                .collect(Collectors.joining("\n\n"));
    }

    public String format(GeneratedItem item, int index, boolean withAnswers) {
        List<String> parts = new ArrayList<>();
        parts.add("--- Задание " + index + " (тип: " + item.kind().wireName() + ") ---");

        if (item instanceof SingleChoiceItem sc) {
            parts.add("Вопрос: " + sc.question());
            parts.add("Варианты: " + numbered(sc.options()));
            if (withAnswers) {
                parts.add("Указанный правильный ответ: вариант " + sc.correctIndex()
                        + " (" + optionAt(sc.options(), sc.correctIndex()) + ")");
            }
        } else if (item instanceof MultipleChoiceItem mc) {
            parts.add("Вопрос: " + mc.question());
            parts.add("Варианты: " + numbered(mc.options()));
            if (withAnswers) {
                parts.add("Указанные правильные: " + nullSafe(mc.correctIndices()).stream()
                        .map(i -> i + ") " + optionAt(mc.options(), i))
                        .collect(Collectors.joining("; ")));
            }
        } else if (item instanceof OpenQuestionItem oq) {
            parts.add("Вопрос: " + oq.question());
            if (withAnswers) {
                parts.add("Указанный ответ: " + oq.correctAnswer());
            }
        } else if (item instanceof MatchingItem m) {
            parts.add("Инструкция: " + m.instruction());
            parts.add("Левый столбец: " + numbered(m.leftColumn()));
            parts.add("Правый столбец: " + numbered(m.rightColumn()));
            if (withAnswers) {
                parts.add("Указанные пары: " + nullSafe(m.correctPairs()).stream()
                        .map(p -> p != null && p.size() == 2 ? p.get(0) + "-" + p.get(1) : String.valueOf(p))
                        .collect(Collectors.joining(", ")));
            }
        } else if (item instanceof FillBlankItem fb) {
            parts.add("Текст: " + fb.textWithBlanks());
            if (withAnswers) {
                parts.add("Пропуски: " + nullSafe(fb.blanks()).stream()
                        .map(b -> "(" + b.position() + ") " + b.correctAnswer())
                        .collect(Collectors.joining("; ")));
            }
        }

        return String.join("\n", parts);
    }

    private static String numbered(List<String> values) {
        List<String> safe = nullSafe(values);
        return IntStream.range(0, safe.size())
                .mapToObj(i -> i + ") " + safe.get(i))
                .collect(Collectors.joining("; "));
    }

    private static String optionAt(List<String> options, Integer index) {
        List<String> safe = nullSafe(options);
        if (index == null || index < 0 || index >= safe.size()) {
            return "?";
        }
        return safe.get(index);
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values == null ? List.of() : values;
    }
}

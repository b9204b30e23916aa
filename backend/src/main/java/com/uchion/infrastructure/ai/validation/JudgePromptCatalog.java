package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.worksheet.model.Subject;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Subject-specific judge instructions, keyed by {@link Subject}.
 * Subjects without an entry fall back to the math instructions.
 */
@Component
public class JudgePromptCatalog {

    /**
     * @param answerRole  system prompt of the answer judge
     * @param qualityRole system prompt of the quality/content judge
     */
    public record SubjectPrompts(String answerRole, String qualityRole) {}

    private static final String SOLVE_AND_COMPARE = """
            Для каждого задания:
            1. Реши его самостоятельно
            2. Сравни свой ответ с указанным
            3. Если не совпадают, укажи ошибку и правильный ответ
            """;

    private static final String OPTIONS_RULES = """
            ВАРИАНТЫ ОТВЕТОВ (для тестов):
            - Среди вариантов ДОЛЖЕН быть правильный
            - Неправильные варианты правдоподобны (типичные ошибки учеников)""";

    static final Map<Subject, SubjectPrompts> PROMPTS = Map.of(
            Subject.MATH, new SubjectPrompts(
                    "Ты проверяющий учитель математики начальной и средней школы (1-6 класс).\n"
                            + SOLVE_AND_COMPARE
                            + "Проверяй: арифметику, дроби, проценты, простые уравнения.",
                    """
                    Ты методист по математике начальной и средней школы. Проверь качество и соответствие каждого задания.

                    КОРРЕКТНОСТЬ ФОРМУЛИРОВКИ:
                    - Условие задачи полное и однозначное
                    - Данные не противоречат друг другу
                    - Задача имеет решение

                    """ + OPTIONS_RULES),
            Subject.ALGEBRA, new SubjectPrompts(
                    "Ты проверяющий учитель алгебры (7-11 класс).\n"
                            + SOLVE_AND_COMPARE
                            + "Проверяй: уравнения, функции, графики, производные, логарифмы, тригонометрию.",
                    """
                    Ты методист по алгебре. Проверь качество и соответствие каждого задания.

                    КОРРЕКТНОСТЬ ФОРМУЛИРОВКИ:
                    - Условие полное и однозначное
                    - Уравнения и неравенства записаны корректно
                    - Задача решается в рамках изученного материала

                    """ + OPTIONS_RULES),
            Subject.GEOMETRY, new SubjectPrompts(
                    "Ты проверяющий учитель геометрии (7-11 класс).\n"
                            + SOLVE_AND_COMPARE
                            + "Проверяй: теоремы, формулы площадей и объёмов, векторы, координаты.",
                    """
                    Ты методист по геометрии. Проверь качество и соответствие каждого задания.

                    КОРРЕКТНОСТЬ ФОРМУЛИРОВКИ:
                    - Условие полное, фигура определена однозначно
                    - Данные не противоречат друг другу
                    - Задача имеет решение

                    """ + OPTIONS_RULES),
            Subject.RUSSIAN, new SubjectPrompts(
                    """
                    Ты проверяющий учитель русского языка (1-11 класс).
                    Для каждого задания:
                    1. Проверь правильность ответа по правилам русского языка
                    2. Если ответ неверный, укажи ошибку и правильный ответ

                    Проверяй: орфографию, пунктуацию, грамматику, части речи, синтаксис.""",
                    """
                    Ты методист по русскому языку. Проверь качество и соответствие каждого задания.

                    КОРРЕКТНОСТЬ ФОРМУЛИРОВКИ:
                    - Пример в вопросе соответствует тому, о чём спрашивается
                    - Части речи, члены предложения и типы предложений классифицированы верно
                    - Термины используются правильно

                    ВАРИАНТЫ ОТВЕТОВ (для тестов):
                    - Среди вариантов ДОЛЖЕН быть хотя бы один правильный
                    - Если ни один вариант не подходит, это ошибка""")
    );

    public SubjectPrompts forSubject(Subject subject) {
        return PROMPTS.getOrDefault(subject, PROMPTS.get(Subject.MATH));
    }
}

package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Local structural checks that need no oracle: answer indices in range, no empty fields,
 * no duplicate options or questions, a minimal question length.
 * <p>
 * Always available. The same per-item rules gate the fixer's output.
 */
@Slf4j
@Component
public class StructureJudge implements Judge {

    public static final String NAME = "structure-checker";

    static final int MIN_QUESTION_LENGTH = 10;
    private static final int DUPLICATE_PREVIEW_LENGTH = 50;

    private record Finding(VerdictStatus severity, Issue issue) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JudgeResult run(List<GeneratedItem> items, DomainContext context) {
        Set<String> seenQuestions = new HashSet<>();
        List<ItemVerdict> verdicts = new ArrayList<>(items.size());

        for (int i = 0; i < items.size(); i++) {
            GeneratedItem item = items.get(i);
            List<Finding> findings = new ArrayList<>(check(item));

            String text = item.promptText();
            if (text != null) {
                String normalized = text.trim().toLowerCase(Locale.ROOT);
                if (normalized.length() >= MIN_QUESTION_LENGTH && !seenQuestions.add(normalized)) {
                    findings.add(error(IssueCode.DUPLICATE_QUESTION,
                            "Дубликат вопроса: \"" + preview(text) + "...\""));
                }
            }
            verdicts.add(toVerdict(i, findings));
        }

        JudgeResult result = JudgeResult.checked(NAME, verdicts, OracleUsage.NONE);
        log.debug("[StructureJudge] {} items: {} errors, {} warnings",
                items.size(), result.totalErrors(), result.totalWarnings());
        return result;
    }

    /**
     * Error-level findings for a single item, without batch-wide rules.
     */
    public List<Issue> structuralErrors(GeneratedItem item) {
        return check(item).stream()
                .filter(f -> f.severity() == VerdictStatus.ERROR)
                .map(Finding::issue)
                .toList();
    }

    private List<Finding> check(GeneratedItem item) {
        List<Finding> findings = new ArrayList<>();
        if (item instanceof SingleChoiceItem sc) {
            checkPrompt(sc.question(), findings);
            List<String> options = nullToEmpty(sc.options());
            if (sc.correctIndex() == null) {
                findings.add(error(IssueCode.EMPTY_FIELD, "Не указан правильный ответ"));
            } else if (sc.correctIndex() < 0 || sc.correctIndex() >= options.size()) {
                findings.add(error(IssueCode.INVALID_INDEX, "correctIndex (%d) вне диапазона [0, %d]"
                        .formatted(sc.correctIndex(), options.size() - 1)));
            }
            checkOptions(options, findings);
            if (options.size() == 3) {
                findings.add(new Finding(VerdictStatus.WARNING,
                        new Issue(IssueCode.FEW_OPTIONS, "Только 3 варианта ответа (рекомендуется 4)")));
            }
        } else if (item instanceof MultipleChoiceItem mc) {
            checkPrompt(mc.question(), findings);
            List<String> options = nullToEmpty(mc.options());
            List<Integer> indices = nullToEmpty(mc.correctIndices());
            if (indices.isEmpty()) {
                findings.add(error(IssueCode.EMPTY_FIELD, "Не указаны правильные ответы"));
            }
            for (Integer idx : indices) {
                if (idx == null || idx < 0 || idx >= options.size()) {
                    findings.add(error(IssueCode.INVALID_INDEX, "correctIndices содержит индекс %s вне диапазона [0, %d]"
                            .formatted(idx, options.size() - 1)));
                }
            }
            if (new HashSet<>(indices).size() != indices.size()) {
                findings.add(error(IssueCode.INVALID_INDEX, "Дубликаты в correctIndices"));
            }
            checkOptions(options, findings);
        } else if (item instanceof OpenQuestionItem oq) {
            checkPrompt(oq.question(), findings);
            if (isBlank(oq.correctAnswer())) {
                findings.add(error(IssueCode.EMPTY_FIELD, "Пустой правильный ответ"));
            }
        } else if (item instanceof MatchingItem m) {
            checkPrompt(m.instruction(), findings);
            checkMatching(m, findings);
        } else if (item instanceof FillBlankItem fb) {
            checkPrompt(fb.textWithBlanks(), findings);
            List<FillBlankItem.Blank> blanks = nullToEmpty(fb.blanks());
            if (blanks.isEmpty()) {
                findings.add(error(IssueCode.EMPTY_FIELD, "Нет пропусков"));
            }
            for (FillBlankItem.Blank blank : blanks) {
                if (blank == null || isBlank(blank.correctAnswer())) {
                    findings.add(error(IssueCode.EMPTY_FIELD, "Пустой ответ для пропуска"));
                }
            }
        }
        return findings;
    }

    private void checkPrompt(String text, List<Finding> findings) {
        if (isBlank(text)) {
            findings.add(error(IssueCode.EMPTY_FIELD, "Пустой текст задания"));
            return;
        }
        int length = text.trim().length();
        if (length < MIN_QUESTION_LENGTH) {
            findings.add(error(IssueCode.QUESTION_TOO_SHORT,
                    "Вопрос слишком короткий (%d символов, минимум %d)".formatted(length, MIN_QUESTION_LENGTH)));
        }
    }

    private void checkOptions(List<String> options, List<Finding> findings) {
        if (options.size() < 2) {
            findings.add(error(IssueCode.EMPTY_FIELD, "Меньше двух вариантов ответа"));
        }
        Set<String> seen = new HashSet<>();
        for (String option : options) {
            if (isBlank(option)) {
                findings.add(error(IssueCode.EMPTY_FIELD, "Пустой вариант ответа"));
            } else if (!seen.add(option.trim().toLowerCase(Locale.ROOT))) {
                findings.add(error(IssueCode.DUPLICATE_OPTIONS, "Повторяющийся вариант ответа: \"" + option.trim() + "\""));
            }
        }
    }

    private void checkMatching(MatchingItem m, List<Finding> findings) {
        List<String> left = nullToEmpty(m.leftColumn());
        List<String> right = nullToEmpty(m.rightColumn());
        List<List<Integer>> pairs = nullToEmpty(m.correctPairs());

        if (left.isEmpty() || right.isEmpty()) {
            findings.add(error(IssueCode.EMPTY_FIELD, "Пустой столбец для сопоставления"));
        }
        if (left.stream().anyMatch(StructureJudge::isBlank) || right.stream().anyMatch(StructureJudge::isBlank)) {
            findings.add(error(IssueCode.EMPTY_FIELD, "Пустой элемент столбца"));
        }
        if (pairs.size() != left.size()) {
            findings.add(error(IssueCode.INVALID_INDEX, "Количество пар (%d) не совпадает с количеством элементов (%d)"
                    .formatted(pairs.size(), left.size())));
        }
        for (List<Integer> pair : pairs) {
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                findings.add(error(IssueCode.INVALID_INDEX, "Некорректная пара " + pair));
                continue;
            }
            int l = pair.get(0);
            int r = pair.get(1);
            if (l < 0 || l >= left.size() || r < 0 || r >= right.size()) {
                findings.add(error(IssueCode.INVALID_INDEX, "Пара [%d, %d] вне диапазона столбцов".formatted(l, r)));
            }
        }
    }

    private static ItemVerdict toVerdict(int index, List<Finding> findings) {
        if (findings.isEmpty()) {
            return ItemVerdict.ok(index);
        }
        boolean hasError = findings.stream().anyMatch(f -> f.severity() == VerdictStatus.ERROR);
        List<Issue> issues = findings.stream().map(Finding::issue).toList();
        return new ItemVerdict(index, hasError ? VerdictStatus.ERROR : VerdictStatus.WARNING, issues);
    }

    private static Finding error(IssueCode code, String message) {
        return new Finding(VerdictStatus.ERROR, new Issue(code, message));
    }

    private static String preview(String text) {
        return text.length() <= DUPLICATE_PREVIEW_LENGTH ? text : text.substring(0, DUPLICATE_PREVIEW_LENGTH);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}

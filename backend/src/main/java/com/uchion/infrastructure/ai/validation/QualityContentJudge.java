package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.curriculum.CurriculumLookup;
import com.uchion.domain.validation.model.Issue;
import com.uchion.domain.validation.model.IssueCode;
import com.uchion.domain.validation.model.ItemVerdict;
import com.uchion.domain.validation.model.VerdictStatus;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.ModelRouter;
import com.uchion.infrastructure.ai.OracleClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unified quality + content check in one oracle call: formulation, answer options,
 * difficulty fit, topic relevance and grade appropriateness.
 */
@Slf4j
@Component
public class QualityContentJudge extends OracleJudge {

    public static final String NAME = "unified-checker";

    static final String TOPICS_NOT_FOUND = "не найдены";

    private static final Set<IssueCode> ALLOWED_CODES = Set.of(
            IssueCode.BAD_FORMULATION, IssueCode.DIFFICULTY_MISMATCH,
            IssueCode.OFF_TOPIC, IssueCode.PARTIAL_MISMATCH);

    private static final Map<IssueCode, String> SUGGESTIONS = Map.of(
            IssueCode.BAD_FORMULATION, "Переформулировать задание или исправить варианты ответов",
            IssueCode.DIFFICULTY_MISMATCH, "Скорректировать сложность задания",
            IssueCode.OFF_TOPIC, "Пересгенерировать задание по указанной теме",
            IssueCode.PARTIAL_MISMATCH, "Проверить соответствие уровню класса");

    private final ModelRouter modelRouter;
    private final JudgePromptCatalog promptCatalog;
    private final ItemPromptFormatter formatter;
    private final CurriculumLookup curriculumLookup;

    public QualityContentJudge(OracleClient oracleClient, ResponseSanitizer sanitizer, ModelRouter modelRouter,
                               JudgePromptCatalog promptCatalog, ItemPromptFormatter formatter,
                               CurriculumLookup curriculumLookup) {
        super(oracleClient, sanitizer);
        this.modelRouter = modelRouter;
        this.promptCatalog = promptCatalog;
        this.formatter = formatter;
        this.curriculumLookup = curriculumLookup;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String callType() {
        return "unified_checker";
    }

    @Override
    protected String model(DomainContext context) {
        return modelRouter.qualityJudgeModel();
    }

    @Override
    protected String systemPrompt(DomainContext context) {
        return promptCatalog.forSubject(context.subject()).qualityRole();
    }

    @Override
    protected String userMessage(List<GeneratedItem> items, DomainContext context) {
        String gradeTopics = curriculumLookup.topicsFor(context.subject(), context.grade())
                .map(topics -> String.join(", ", topics))
                .orElse(TOPICS_NOT_FOUND);
        String difficultyName = context.difficulty() != null ? context.difficulty().displayName() : "не задан";
        String difficultyId = context.difficulty() != null ? context.difficulty().wireName() : "-";

        StringBuilder sb = new StringBuilder();
        sb.append("Предмет: ").append(context.subject().displayName()).append("\n");
        sb.append("Класс: ").append(context.grade()).append("\n");
        sb.append("Тема: \"").append(context.topic()).append("\"\n");
        sb.append("Уровень сложности: ").append(difficultyName).append(" (").append(difficultyId).append(")\n");
        sb.append("\nТемы программы ").append(context.grade()).append(" класса: ").append(gradeTopics).append("\n");
        sb.append("""

                КРИТЕРИИ СЛОЖНОСТИ:
                - easy: 1-2 действия, простые примеры, прямое применение правил
                - medium: 2-3 действия, стандартные случаи из учебника
                - hard: 3+ действий, составные задачи, нестандартные случаи

                Вот задания для проверки:

                """);
        sb.append(formatter.formatBatch(items, false)).append("\n\n");
        sb.append("""
                Для каждого задания проверь ВСЁ:
                1. Корректность формулировки (полное, однозначное, решаемое)
                2. Правильность вариантов ответов (есть правильный вариант)
                3. Соответствие уровню сложности "%1$s"
                4. Соответствие теме "%2$s"
                5. Соответствие программе %3$d класса (нет лишних терминов)

                Верни ТОЛЬКО JSON (без markdown):
                {
                  "tasks": [
                    {"index": 0, "status": "ok"},
                    {"index": 1, "status": "error", "code": "BAD_FORMULATION", "issue": "Описание проблемы"},
                    {"index": 2, "status": "warning", "code": "DIFFICULTY_MISMATCH", "issue": "Задание слишком лёгкое"}
                  ]
                }

                Проверь ВСЕ %4$d заданий. Индексы от 0 до %5$d.
                Коды:
                - "BAD_FORMULATION" (error): формулировка некорректна, нет правильного варианта, нерешаемо
                - "DIFFICULTY_MISMATCH" (warning): сложность не соответствует уровню %1$s
                - "OFF_TOPIC" (error): полностью не соответствует теме или классу
                - "PARTIAL_MISMATCH" (warning): частично выходит за рамки или использует сложные термины
                Если задание в порядке, верни "ok" без code и issue."""
                .formatted(difficultyName, context.topic(), context.grade(), items.size(), items.size() - 1));
        return sb.toString();
    }

    @Override
    protected ItemVerdict toVerdict(RawVerdict raw) {
        if (raw.status() == VerdictStatus.OK) {
            return ItemVerdict.ok(raw.index());
        }
        IssueCode code = resolveCode(raw);
        String message = raw.issue() != null ? raw.issue() : "Задание не прошло проверку качества";
        return ItemVerdict.of(raw.index(), raw.status(), new Issue(code, message, SUGGESTIONS.get(code)));
    }

    private IssueCode resolveCode(RawVerdict raw) {
        IssueCode fallback = raw.status() == VerdictStatus.ERROR
                ? IssueCode.BAD_FORMULATION
                : IssueCode.DIFFICULTY_MISMATCH;
        if (raw.code() == null) {
            return fallback;
        }
        try {
            IssueCode code = IssueCode.valueOf(raw.code().trim().toUpperCase());
            return ALLOWED_CODES.contains(code) ? code : fallback;
        } catch (IllegalArgumentException e) {
            log.debug("[{}] Unknown issue code '{}' for item {}", NAME, raw.code(), raw.index());
            return fallback;
        }
    }
}

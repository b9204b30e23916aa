package com.uchion.infrastructure.ai.validation;

import com.uchion.domain.validation.model.Issue;
import com.uchion.domain.validation.model.IssueCode;
import com.uchion.domain.validation.model.ItemVerdict;
import com.uchion.domain.validation.model.VerdictStatus;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.ModelRouter;
import com.uchion.infrastructure.ai.OracleClient;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks that the stated correct answers are actually correct.
 * Only ever reports {@code ok} or {@code error/WRONG_ANSWER}; warnings from the oracle count as ok.
 */
@Component
public class AnswerJudge extends OracleJudge {

    public static final String NAME = "answer-verifier";

    private static final String SUGGESTION = "Пересгенерировать задание или исправить ответ";
    private static final String DEFAULT_MESSAGE = "Указанный ответ неверен";

    private final ModelRouter modelRouter;
    private final JudgePromptCatalog promptCatalog;
    private final ItemPromptFormatter formatter;

    public AnswerJudge(OracleClient oracleClient, ResponseSanitizer sanitizer, ModelRouter modelRouter,
                       JudgePromptCatalog promptCatalog, ItemPromptFormatter formatter) {
        super(oracleClient, sanitizer);
        this.modelRouter = modelRouter;
        this.promptCatalog = promptCatalog;
        this.formatter = formatter;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String callType() {
        return "answer_verifier";
    }

    @Override
    protected String model(DomainContext context) {
        return modelRouter.answerJudgeModel(context);
    }

    @Override
    protected String systemPrompt(DomainContext context) {
        return promptCatalog.forSubject(context.subject()).answerRole();
    }

    @Override
    protected String userMessage(List<GeneratedItem> items, DomainContext context) {
        return """
                Вот задания для проверки:

                %s

                Верни ТОЛЬКО JSON (без markdown):
                {
                  "tasks": [
                    {"index": 0, "status": "ok"},
                    {"index": 1, "status": "error", "issue": "Неверный ответ. Указано: ... Правильно: ..."}
                  ]
                }

                Проверь ВСЕ %d заданий. Индексы от 0 до %d."""
                .formatted(formatter.formatBatch(items, true), items.size(), items.size() - 1);
    }

    @Override
    protected ItemVerdict toVerdict(RawVerdict raw) {
        if (raw.status() != VerdictStatus.ERROR) {
            return ItemVerdict.ok(raw.index());
        }
        String message = raw.issue() != null ? raw.issue() : DEFAULT_MESSAGE;
        return ItemVerdict.of(raw.index(), VerdictStatus.ERROR,
                new Issue(IssueCode.WRONG_ANSWER, message, SUGGESTION));
    }
}

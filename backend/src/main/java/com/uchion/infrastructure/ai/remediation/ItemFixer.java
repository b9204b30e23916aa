package com.uchion.infrastructure.ai.remediation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uchion.domain.validation.model.FixOutcome;
import com.uchion.domain.validation.model.Issue;
import com.uchion.domain.validation.model.IssueCode;
import com.uchion.domain.validation.model.OracleUsage;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.LlmCallResult;
import com.uchion.infrastructure.ai.ModelRouter;
import com.uchion.infrastructure.ai.OracleClient;
import com.uchion.infrastructure.ai.validation.ResponseSanitizer;
import com.uchion.infrastructure.ai.validation.StructureJudge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks the rewrite oracle to repair one item given its most critical issue.
 * <p>
 * The reply keeps the original item kind whatever the oracle wrote in {@code type},
 * and must pass the structural rules before it is offered as a replacement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemFixer {

    static final String NO_API_KEY = "No API key";

    private static final double TEMPERATURE = 0.2;
    private static final int MAX_TOKENS = 3000;
    private static final String CALLER = "ItemFixer";

    private static final String SYSTEM_PROMPT = "Ты — редактор учебных материалов для российской школы. "
            + "Отвечаешь только JSON одного задания, без пояснений.";

    private final OracleClient oracleClient;
    private final ModelRouter modelRouter;
    private final ResponseSanitizer sanitizer;
    private final StructureJudge structureJudge;
    private final ObjectMapper objectMapper;

    public FixOutcome fix(int itemIndex, GeneratedItem item, Issue primaryIssue, DomainContext context) {
        long start = System.currentTimeMillis();

        if (!oracleClient.isConfigured()) {
            return FixOutcome.failed(itemIndex, NO_API_KEY, OracleUsage.NONE);
        }

        String userPrompt;
        try {
            userPrompt = buildPrompt(item, primaryIssue, context);
        } catch (JsonProcessingException e) {
            log.warn("[{}] Could not serialize item {}: {}", CALLER, itemIndex, e.getOriginalMessage());
            return FixOutcome.failed(itemIndex, "Item could not be serialized", OracleUsage.NONE);
        }

        LlmCallResult result;
        try {
            result = oracleClient.callWithModel("fixer", modelRouter.fixerModel(context),
                    SYSTEM_PROMPT, userPrompt, TEMPERATURE, MAX_TOKENS);
        } catch (RuntimeException e) {
            log.error("[{}] Item {} failed in {}ms: {}", CALLER, itemIndex,
                    System.currentTimeMillis() - start, e.getMessage());
            return FixOutcome.failed(itemIndex, e.getMessage() != null ? e.getMessage() : "Oracle call failed",
                    OracleUsage.NONE);
        }
        OracleUsage usage = result.usage();

        String json = sanitizer.extractFencedOrObject(result.content());
        if (json == null) {
            log.warn("[{}] No JSON in response for item {} ({}ms), keeping original",
                    CALLER, itemIndex, System.currentTimeMillis() - start);
            return FixOutcome.failed(itemIndex, "No JSON in oracle response", usage);
        }

        JsonNode node = sanitizer.parse(json, CALLER);
        if (!(node instanceof ObjectNode objectNode)) {
            log.warn("[{}] JSON parse failed for item {}, keeping original", CALLER, itemIndex);
            return FixOutcome.failed(itemIndex, "JSON parse failed", usage);
        }

        objectNode.put("type", item.kind().wireName());

        GeneratedItem fixed;
        try {
            fixed = objectMapper.treeToValue(objectNode, GeneratedItem.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[{}] Repaired item {} does not match its kind: {}", CALLER, itemIndex, e.getMessage());
            return FixOutcome.failed(itemIndex, "Repaired item does not match kind " + item.kind().wireName(), usage);
        }

        List<Issue> structural = structureJudge.structuralErrors(fixed);
        if (!structural.isEmpty()) {
            log.warn("[{}] Repaired item {} is structurally broken: {}", CALLER, itemIndex, structural.get(0).message());
            return FixOutcome.failed(itemIndex, "Repaired item is invalid: " + structural.get(0).message(), usage);
        }

        log.info("[{}] Fixed item {} in {}ms ({})", CALLER, itemIndex,
                System.currentTimeMillis() - start, primaryIssue.code());
        return FixOutcome.fixed(itemIndex, fixed, primaryIssue.code() + ": исправлено", usage);
    }

    private String buildPrompt(GeneratedItem item, Issue issue, DomainContext context) throws JsonProcessingException {
        String itemJson = objectMapper.writerFor(GeneratedItem.class)
                .withDefaultPrettyPrinter()
                .writeValueAsString(item);
        String suggestionLine = issue.suggestion() != null ? "\nРЕКОМЕНДАЦИЯ: " + issue.suggestion() : "";
        String kind = item.kind().wireName();

        StringBuilder sb = new StringBuilder();
        sb.append("Предмет: ").append(context.subject().displayName()).append("\n");
        sb.append("Класс: ").append(context.grade()).append("\n");
        sb.append("Тема: \"").append(context.topic()).append("\"\n");

        if (issue.code() == IssueCode.DIFFICULTY_MISMATCH && context.difficulty() != null) {
            String difficultyName = context.difficulty().displayName();
            sb.append("Требуемый уровень сложности: ").append(difficultyName).append("\n\n");
            sb.append("ТЕКУЩЕЕ ЗАДАНИЕ (не соответствует уровню сложности):\n").append(itemJson).append("\n\n");
            sb.append("ПРОБЛЕМА:\n").append(issue.message()).append(suggestionLine).append("\n\n");
            sb.append("""
                    ЗАДАЧА:
                    1. Создай НОВОЕ задание по той же теме, но строго уровня "%s"
                    2. Убедись что ответ правильный
                    3. Сохрани тип и формат задания (type: "%s")

                    Верни новое задание в том же JSON формате.
                    Только JSON, без пояснений.""".formatted(difficultyName, kind));
        } else {
            sb.append("\nЗАДАНИЕ С ОШИБКОЙ:\n").append(itemJson).append("\n\n");
            sb.append("НАЙДЕННАЯ ОШИБКА:\n").append(issue.message()).append(suggestionLine).append("\n\n");
            sb.append("""
                    ЗАДАЧА:
                    1. Исправь ошибку
                    2. Убедись что ответ правильный
                    3. Сохрани тип и формат задания (type: "%s")

                    Верни исправленное задание в том же JSON формате.
                    Только JSON, без пояснений.""".formatted(kind));
        }
        return sb.toString();
    }
}

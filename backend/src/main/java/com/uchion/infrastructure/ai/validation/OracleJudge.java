package com.uchion.infrastructure.ai.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.LlmCallResult;
import com.uchion.infrastructure.ai.OracleClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Judge backed by one oracle round trip.
 * <p>
 * credentials → prompt → call → first JSON block → sanitize/decode → verdicts.
 * Every failure along the way degrades to {@link JudgeResult#unavailable}.
 */
@Slf4j
public abstract class OracleJudge implements Judge {

    protected static final double TEMPERATURE = 0.1;
    protected static final int MAX_TOKENS = 4000;

    protected final OracleClient oracleClient;
    protected final ResponseSanitizer sanitizer;

    protected OracleJudge(OracleClient oracleClient, ResponseSanitizer sanitizer) {
        this.oracleClient = oracleClient;
        this.sanitizer = sanitizer;
    }

    /**
     * One decoded entry of the oracle's {@code tasks} array.
     */
    protected record RawVerdict(int index, VerdictStatus status, String code, String issue) {}

    protected abstract String callType();

    protected abstract String model(DomainContext context);

    protected abstract String systemPrompt(DomainContext context);

    protected abstract String userMessage(List<GeneratedItem> items, DomainContext context);

    /**
     * Maps one decoded entry to a verdict. Only called for indices inside the batch.
     */
    protected abstract ItemVerdict toVerdict(RawVerdict raw);

    @Override
    public JudgeResult run(List<GeneratedItem> items, DomainContext context) {
        long start = System.currentTimeMillis();

        if (!oracleClient.isConfigured()) {
            log.warn("[{}] No API key, skipping", name());
            return JudgeResult.unavailable(name(), IssueCode.NO_CREDENTIALS, "No oracle credentials configured");
        }

        LlmCallResult result;
        try {
            result = oracleClient.callWithModel(callType(), model(context),
                    systemPrompt(context), userMessage(items, context), TEMPERATURE, MAX_TOKENS);
        } catch (RuntimeException e) {
            log.error("[{}] Failed in {}ms: {}", name(), System.currentTimeMillis() - start, e.getMessage());
            return JudgeResult.unavailable(name(), IssueCode.AGENT_ERROR);
        }

        String json = sanitizer.extractObject(result.content());
        if (json == null) {
            log.warn("[{}] No JSON in response", name());
            return JudgeResult.unavailable(name(), IssueCode.NO_JSON_RESPONSE);
        }

        JsonNode root = sanitizer.parse(json, name());
        if (root == null) {
            return JudgeResult.unavailable(name(), IssueCode.JSON_PARSE_ERROR);
        }

        List<ItemVerdict> verdicts = new ArrayList<>();
        for (JsonNode entry : root.path("tasks")) {
            RawVerdict raw = readEntry(entry);
            if (raw == null) continue;
            if (raw.index() < 0 || raw.index() >= items.size()) {
                log.debug("[{}] Dropping verdict for unknown index {}", name(), raw.index());
                continue;
            }
            verdicts.add(toVerdict(raw));
        }

        JudgeResult judgeResult = JudgeResult.checked(name(), verdicts, result.usage());
        log.info("[{}] Done in {}ms: {} errors, {} warnings",
                name(), System.currentTimeMillis() - start, judgeResult.totalErrors(), judgeResult.totalWarnings());
        return judgeResult;
    }

    private RawVerdict readEntry(JsonNode entry) {
        JsonNode index = entry.get("index");
        if (index == null || !index.canConvertToInt()) {
            return null;
        }
        return new RawVerdict(
                index.asInt(),
                VerdictStatus.parse(entry.path("status").asText(null)),
                textOrNull(entry, "code"),
                textOrNull(entry, "issue"));
    }

    private static String textOrNull(JsonNode entry, String field) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}

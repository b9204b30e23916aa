package com.uchion.infrastructure.ai.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes JSON returned by an oracle, tolerating one known defect: backslash escapes
 * JSON does not define (models write {@code \(} or {@code \^} when quoting formulas).
 * <p>
 * A {@code null} result means "no signal" and is never an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseSanitizer {

    private static final int RAW_LOG_LIMIT = 500;
    private static final String VALID_ESCAPES = "\"\\/bfnrtu";

    private static final Pattern ESCAPE_PATTERN = Pattern.compile("\\\\(.)", Pattern.DOTALL);
    private static final Pattern FENCED_OBJECT = Pattern.compile("```(?:json)?\\s*(\\{[\\s\\S]*?\\})\\s*```");

    private final ObjectMapper objectMapper;

    /**
     * Strict decode, then one retry after dropping unsupported escapes.
     *
     * @param raw    text believed to hold one JSON value
     * @param caller component name for log lines
     * @return the decoded tree, or {@code null} when both attempts fail
     */
    public JsonNode parse(String raw, String caller) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("[{}] Strict JSON decode failed: {}", caller, e.getOriginalMessage());
        }

        String sanitized = stripInvalidEscapes(raw);
        try {
            JsonNode node = objectMapper.readTree(sanitized);
            log.warn("[{}] Sanitized invalid escape sequences in JSON", caller);
            return node;
        } catch (JsonProcessingException e) {
            log.warn("[{}] Failed to parse JSON even after sanitization. Raw (first {} chars): {}",
                    caller, RAW_LOG_LIMIT, truncate(raw), e);
            return null;
        }
    }

    /**
     * Drops the backslash of every escape JSON does not support. Valid escapes,
     * including an escaped backslash, are kept as they are.
     */
    static String stripInvalidEscapes(String raw) {
        Matcher m = ESCAPE_PATTERN.matcher(raw);
        StringBuilder sb = new StringBuilder(raw.length());
        while (m.find()) {
            String escaped = m.group(1);
            String replacement = VALID_ESCAPES.contains(escaped) ? "\\" + escaped : escaped;
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * First {@code '{'} through last {@code '}'} of a free-form answer.
     */
    public String extractObject(String content) {
        if (content == null) return null;
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        return content.substring(start, end + 1);
    }

    /**
     * A fenced {@code ```json} object when present, otherwise {@link #extractObject(String)}.
     */
    public String extractFencedOrObject(String content) {
        if (content == null) return null;
        Matcher m = FENCED_OBJECT.matcher(content);
        if (m.find()) {
            return m.group(1);
        }
        return extractObject(content);
    }

    private static String truncate(String raw) {
        return raw.length() <= RAW_LOG_LIMIT ? raw : raw.substring(0, RAW_LOG_LIMIT);
    }
}

package com.uchion.infrastructure.ai;

import com.uchion.domain.validation.model.OracleUsage;

/**
 * Result of an LLM API call including token usage for cost tracking.
 */
public record LlmCallResult(String content, String model, long promptTokens, long completionTokens) {

    public OracleUsage usage() {
        return new OracleUsage(promptTokens, completionTokens);
    }
}

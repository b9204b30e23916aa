package com.uchion.domain.validation.model;

/**
 * Counters for one pipeline run. {@code durationMs} is the only wall-clock value.
 */
public record ValidationStats(
        int judgeCount,
        int fixAttempts,
        int fixesCommitted,
        int fixesReverted,
        long promptTokens,
        long completionTokens,
        long durationMs
) {}

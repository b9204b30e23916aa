package com.uchion.domain.validation.model;

/**
 * Token usage of one or more oracle calls, kept for external cost accounting.
 */
public record OracleUsage(long promptTokens, long completionTokens) {

    public static final OracleUsage NONE = new OracleUsage(0, 0);

    public OracleUsage plus(OracleUsage other) {
        if (other == null) return this;
        return new OracleUsage(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }
}

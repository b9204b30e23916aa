package com.uchion.domain.validation.model;

/**
 * Closed set of issue codes. Item-level codes come from the judges; judge-level codes
 * only appear on the index {@code -1} notice of an unavailable judge.
 */
public enum IssueCode {
    // answer-verifier
    WRONG_ANSWER,

    // unified-checker
    BAD_FORMULATION,
    DIFFICULTY_MISMATCH,
    OFF_TOPIC,
    PARTIAL_MISMATCH,

    // structure-checker
    INVALID_INDEX,
    EMPTY_FIELD,
    DUPLICATE_OPTIONS,
    DUPLICATE_QUESTION,
    QUESTION_TOO_SHORT,
    FEW_OPTIONS,

    // judge-level
    NO_CREDENTIALS,
    NO_JSON_RESPONSE,
    JSON_PARSE_ERROR,
    AGENT_ERROR
}

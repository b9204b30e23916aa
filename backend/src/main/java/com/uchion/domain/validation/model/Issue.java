package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single finding about an item.
 *
 * @param code       machine-readable code, used for remediation decisions
 * @param message    human-readable description
 * @param suggestion optional hint for the teacher or the fixer (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Issue(
        IssueCode code,
        String message,
        String suggestion
) {
    public Issue(IssueCode code, String message) {
        this(code, message, null);
    }
}

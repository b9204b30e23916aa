package com.uchion.domain.validation.model;

import java.util.List;

/**
 * An item chosen for automatic repair, with its issues in judge-submission order.
 * The first issue is the one handed to the fixer.
 */
public record RemediationCandidate(int itemIndex, List<Issue> issues, boolean hasError) {

    public RemediationCandidate {
        issues = List.copyOf(issues);
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("Candidate " + itemIndex + " has no issues");
        }
    }

    public Issue primaryIssue() {
        return issues.get(0);
    }
}

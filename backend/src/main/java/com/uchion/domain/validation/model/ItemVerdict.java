package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * One judge's verdict about one item.
 * <p>
 * {@code issues} is non-empty iff {@code status != OK}. Index {@code -1} marks a
 * judge-level notice rather than an item.
 */
public record ItemVerdict(
        int itemIndex,
        VerdictStatus status,
        List<Issue> issues
) {
    public static final int JUDGE_LEVEL_INDEX = -1;

    public ItemVerdict {
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (status == VerdictStatus.OK && !issues.isEmpty()) {
            throw new IllegalArgumentException("OK verdict must not carry issues (item " + itemIndex + ")");
        }
        if (status != VerdictStatus.OK && issues.isEmpty()) {
            throw new IllegalArgumentException(status + " verdict must carry at least one issue (item " + itemIndex + ")");
        }
    }

    public static ItemVerdict ok(int itemIndex) {
        return new ItemVerdict(itemIndex, VerdictStatus.OK, List.of());
    }

    public static ItemVerdict of(int itemIndex, VerdictStatus status, Issue issue) {
        return new ItemVerdict(itemIndex, status, List.of(issue));
    }

    @JsonIgnore
    public boolean isItemLevel() {
        return itemIndex >= 0;
    }
}

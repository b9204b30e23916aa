package com.uchion.domain.validation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Everything one judge reported for a batch.
 * <p>
 * {@code totalErrors} and {@code totalWarnings} are always recomputed from {@code verdicts}.
 */
public record JudgeResult(
        String judgeName,
        JudgeOutcome outcome,
        List<ItemVerdict> verdicts,
        int totalErrors,
        int totalWarnings,
        OracleUsage usage
) {
    public JudgeResult {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
        totalErrors = (int) verdicts.stream().filter(v -> v.status() == VerdictStatus.ERROR).count();
        totalWarnings = (int) verdicts.stream().filter(v -> v.status() == VerdictStatus.WARNING).count();
        usage = usage == null ? OracleUsage.NONE : usage;
    }

    public static JudgeResult checked(String judgeName, List<ItemVerdict> verdicts, OracleUsage usage) {
        return new JudgeResult(judgeName, JudgeOutcome.checked(), verdicts, 0, 0, usage);
    }

    /**
     * Degraded result: no item verdicts, one index {@code -1} warning naming why.
     */
    public static JudgeResult unavailable(String judgeName, IssueCode reason, String message) {
        ItemVerdict notice = ItemVerdict.of(ItemVerdict.JUDGE_LEVEL_INDEX, VerdictStatus.WARNING,
                new Issue(reason, message));
        return new JudgeResult(judgeName, JudgeOutcome.unavailable(reason), List.of(notice), 0, 0, OracleUsage.NONE);
    }

    public static JudgeResult unavailable(String judgeName, IssueCode reason) {
        return unavailable(judgeName, reason, "Judge could not complete verification");
    }

    @JsonIgnore
    public boolean isAvailable() {
        return outcome.isAvailable();
    }

    @JsonIgnore
    public List<ItemVerdict> itemVerdicts() {
        return verdicts.stream().filter(ItemVerdict::isItemLevel).toList();
    }
}

package com.uchion.domain.validation.model;

import com.uchion.domain.worksheet.model.GeneratedItem;

import java.util.List;

/**
 * Sole artifact handed to rendering and persistence.
 *
 * @param valid          {@code problemItems.isEmpty()}, from pre-remediation verdicts
 * @param judgeResults   one entry per judge, in submission order
 * @param problemItems   sorted unique indices with an error verdict from any judge
 * @param allIssues      every item-level issue, judge order then verdict order
 * @param finalItems     the batch with committed repairs applied
 * @param fixOutcomes    repair attempts in selection order
 * @param uncheckedJudges names of judges that could not check the batch
 * @param stats          counters and timing
 */
public record ValidationReport(
        boolean valid,
        List<JudgeResult> judgeResults,
        List<Integer> problemItems,
        List<AttributedIssue> allIssues,
        List<GeneratedItem> finalItems,
        List<FixOutcome> fixOutcomes,
        List<String> uncheckedJudges,
        ValidationStats stats
) {
    public ValidationReport {
        problemItems = List.copyOf(problemItems);
        valid = problemItems.isEmpty();
        judgeResults = List.copyOf(judgeResults);
        allIssues = List.copyOf(allIssues);
        finalItems = List.copyOf(finalItems);
        fixOutcomes = List.copyOf(fixOutcomes);
        uncheckedJudges = List.copyOf(uncheckedJudges);
    }

    public boolean fullyChecked() {
        return uncheckedJudges.isEmpty();
    }
}

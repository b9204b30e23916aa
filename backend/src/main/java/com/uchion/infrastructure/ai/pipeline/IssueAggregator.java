package com.uchion.infrastructure.ai.pipeline;

import com.uchion.domain.validation.model.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Folds judge results into the batch-level view: which items failed and every issue raised.
 * Warnings never make an item a problem item.
 */
@Component
public class IssueAggregator {

    public record Aggregation(List<Integer> problemItems, List<AttributedIssue> allIssues) {
        public Aggregation {
            problemItems = List.copyOf(problemItems);
            allIssues = List.copyOf(allIssues);
        }
    }

    /**
     * @param judgeResults results in judge-submission order
     */
    public Aggregation aggregate(List<JudgeResult> judgeResults) {
        TreeSet<Integer> problemItems = new TreeSet<>();
        List<AttributedIssue> allIssues = new ArrayList<>();

        for (JudgeResult result : judgeResults) {
            for (ItemVerdict verdict : result.itemVerdicts()) {
                for (Issue issue : verdict.issues()) {
                    allIssues.add(new AttributedIssue(verdict.itemIndex(), result.judgeName(), issue));
                }
                if (verdict.status() == VerdictStatus.ERROR) {
                    problemItems.add(verdict.itemIndex());
                }
            }
        }
        return new Aggregation(new ArrayList<>(problemItems), allIssues);
    }
}

package com.uchion.infrastructure.ai.remediation;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.infrastructure.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Chooses which items the fixer gets to see, in which order, within the remediation budget.
 * <p>
 * An item qualifies through an error verdict from any judge or a warning whose code is
 * configured as remediable. Items with an error go first, then warning-only items,
 * each group by ascending index.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemediationSelector {

    private final ValidationProperties properties;

    public RemediationWorklist select(List<JudgeResult> judgeResults, DomainContext context) {
        ValidationProperties.Remediation policy = properties.getRemediation();
        RemediationWorklist worklist = new RemediationWorklist(policy.getBudget());

        SortedMap<Integer, List<Issue>> issuesByItem = new TreeMap<>();
        Set<Integer> errorItems = new HashSet<>();

        for (JudgeResult result : judgeResults) {
            for (ItemVerdict verdict : result.itemVerdicts()) {
                if (verdict.status() == VerdictStatus.ERROR) {
                    errorItems.add(verdict.itemIndex());
                    issuesByItem.computeIfAbsent(verdict.itemIndex(), k -> new ArrayList<>())
                            .addAll(verdict.issues());
                } else if (verdict.status() == VerdictStatus.WARNING) {
                    List<Issue> remediable = verdict.issues().stream()
                            .filter(issue -> policy.getRemediableWarnings().contains(issue.code()))
                            .toList();
                    if (!remediable.isEmpty()) {
                        issuesByItem.computeIfAbsent(verdict.itemIndex(), k -> new ArrayList<>())
                                .addAll(remediable);
                    }
                }
            }
        }

        if (issuesByItem.isEmpty()) {
            return worklist;
        }

        if (policy.getExcludedSubjects().contains(context.subject())) {
            log.info("[RemediationSelector] Auto-fix disabled for subject {}, reporting only: items {}",
                    context.subject().wireName(), issuesByItem.keySet());
            return new RemediationWorklist(0);
        }

        List<RemediationCandidate> ordered = new ArrayList<>();
        issuesByItem.forEach((index, issues) ->
                ordered.add(new RemediationCandidate(index, issues, errorItems.contains(index))));
        ordered.sort(Comparator.comparing((RemediationCandidate c) -> !c.hasError())
                .thenComparingInt(RemediationCandidate::itemIndex));

        ordered.forEach(worklist::offer);

        if (!worklist.droppedIndices().isEmpty()) {
            log.warn("[RemediationSelector] Budget of {} reached, left unrepaired: {}",
                    worklist.capacity(), worklist.droppedIndices());
        }
        log.info("[RemediationSelector] Selected {} items for repair: {}", worklist.candidates().size(),
                worklist.candidates().stream().map(RemediationCandidate::itemIndex).toList());
        return worklist;
    }
}

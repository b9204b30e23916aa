package com.uchion.infrastructure.ai.pipeline;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline run. Each run owns its own instance and its own item copies.
 */
@Data
public class ValidationPipelineContext {

    public enum Stage {
        START, JUDGING, AGGREGATING, SELECTING, REPAIRING, REVERIFYING, DONE
    }

    // --- Input ---
    private List<GeneratedItem> items;
    private DomainContext domainContext;
    private ValidationOptions options;
    private long startMillis;

    private Stage stage = Stage.START;

    // --- Judging ---
    private List<JudgeResult> judgeResults = new ArrayList<>();

    // --- Aggregating ---
    private List<Integer> problemItems = new ArrayList<>();
    private List<AttributedIssue> allIssues = new ArrayList<>();

    // --- Selecting ---
    private List<RemediationCandidate> candidates = new ArrayList<>();

    // --- Repairing / Reverifying ---
    private List<GeneratedItem> finalItems = new ArrayList<>();
    private List<FixOutcome> fixOutcomes = new ArrayList<>();
    private int fixAttempts;
    private int fixesCommitted;
    private int fixesReverted;
    private OracleUsage remediationUsage = OracleUsage.NONE;

    public static ValidationPipelineContext start(List<GeneratedItem> items, DomainContext domainContext,
                                                  ValidationOptions options) {
        ValidationPipelineContext ctx = new ValidationPipelineContext();
        ctx.setItems(List.copyOf(items));
        ctx.setDomainContext(domainContext);
        ctx.setOptions(options != null ? options : ValidationOptions.defaults());
        ctx.setFinalItems(new ArrayList<>(items));
        ctx.setStartMillis(System.currentTimeMillis());
        return ctx;
    }

    public void addRemediationUsage(OracleUsage usage) {
        remediationUsage = remediationUsage.plus(usage);
    }

    /**
     * Build the final report from whatever the stages produced.
     */
    public ValidationReport toReport() {
        OracleUsage usage = judgeResults.stream()
                .map(JudgeResult::usage)
                .reduce(OracleUsage.NONE, OracleUsage::plus)
                .plus(remediationUsage);

        List<String> unchecked = judgeResults.stream()
                .filter(r -> !r.isAvailable())
                .map(JudgeResult::judgeName)
                .toList();

        ValidationStats stats = new ValidationStats(
                judgeResults.size(),
                fixAttempts,
                fixesCommitted,
                fixesReverted,
                usage.promptTokens(),
                usage.completionTokens(),
                System.currentTimeMillis() - startMillis);

        return new ValidationReport(
                problemItems.isEmpty(),
                judgeResults,
                problemItems,
                allIssues,
                finalItems,
                fixOutcomes,
                unchecked,
                stats);
    }
}

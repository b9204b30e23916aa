package com.uchion.infrastructure.ai.pipeline;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.validation.service.ValidationService;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.pipeline.ValidationPipelineContext.Stage;
import com.uchion.infrastructure.ai.remediation.ItemFixer;
import com.uchion.infrastructure.ai.remediation.RemediationSelector;
import com.uchion.infrastructure.ai.remediation.ReverificationGate;
import com.uchion.infrastructure.ai.validation.AnswerJudge;
import com.uchion.infrastructure.ai.validation.Judge;
import com.uchion.infrastructure.ai.validation.QualityContentJudge;
import com.uchion.infrastructure.ai.validation.StructureJudge;
import com.uchion.infrastructure.config.ValidationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Validation pipeline orchestrator.
 *
 * Pipeline:
 *   JUDGING (all judges in parallel, shared deadline) → AGGREGATING → SELECTING
 *   → REPAIRING (sequential, budget-capped) → REVERIFYING (one batched answer check) → DONE
 *
 * Every oracle call runs on the judge pool under the judge timeout and is registered with the
 * run's {@link CancellationToken}. Never throws to the caller: every failure ends up inside the report.
 */
@Slf4j
@Component
public class ValidationPipeline implements ValidationService {

    private final AnswerJudge answerJudge;
    private final QualityContentJudge qualityJudge;
    private final StructureJudge structureJudge;
    private final IssueAggregator aggregator;
    private final RemediationSelector selector;
    private final ItemFixer fixer;
    private final ReverificationGate gate;
    private final ValidationProperties properties;
    private final OracleCallRunner runner;

    public ValidationPipeline(AnswerJudge answerJudge,
                              QualityContentJudge qualityJudge,
                              StructureJudge structureJudge,
                              IssueAggregator aggregator,
                              RemediationSelector selector,
                              ItemFixer fixer,
                              ReverificationGate gate,
                              ValidationProperties properties,
                              OracleCallRunner runner) {
        this.answerJudge = answerJudge;
        this.qualityJudge = qualityJudge;
        this.structureJudge = structureJudge;
        this.aggregator = aggregator;
        this.selector = selector;
        this.fixer = fixer;
        this.gate = gate;
        this.properties = properties;
        this.runner = runner;
    }

    @Override
    public ValidationReport validate(List<GeneratedItem> items, DomainContext context, ValidationOptions options) {
        return validate(items, context, options, CancellationToken.none());
    }

    public ValidationReport validate(List<GeneratedItem> items, DomainContext context, ValidationOptions options,
                                     CancellationToken token) {
        ValidationPipelineContext ctx = ValidationPipelineContext.start(items, context, options);

        if (ctx.getItems().isEmpty()) {
            log.info("[Validation] Empty batch, nothing to check");
            ctx.setStage(Stage.DONE);
            return ctx.toReport();
        }

        runJudges(ctx, token);

        try {
            ctx.setStage(Stage.AGGREGATING);
            IssueAggregator.Aggregation aggregation = aggregator.aggregate(ctx.getJudgeResults());
            ctx.setProblemItems(new ArrayList<>(aggregation.problemItems()));
            ctx.setAllIssues(new ArrayList<>(aggregation.allIssues()));
            log.info("[Validation] {} items: {} problem items, {} issues, unchecked judges: {}",
                    ctx.getItems().size(), ctx.getProblemItems().size(), ctx.getAllIssues().size(),
                    ctx.getJudgeResults().stream().filter(r -> !r.isAvailable()).map(JudgeResult::judgeName).toList());

            if (ctx.getOptions().autoFix() && !token.isCancelled()) {
                ctx.setStage(Stage.SELECTING);
                ctx.setCandidates(new ArrayList<>(selector.select(ctx.getJudgeResults(), context).candidates()));

                if (!ctx.getCandidates().isEmpty()) {
                    repair(ctx, token);
                    reverify(ctx, token);
                }
            }
        } catch (RuntimeException e) {
            log.error("[Validation] Stage {} failed, returning partial report", ctx.getStage(), e);
        }

        ctx.setStage(Stage.DONE);
        ValidationReport report = ctx.toReport();
        log.info("[Validation] Done in {}ms: {} problems, {} fixed, {} issues",
                report.stats().durationMs(), report.problemItems().size(),
                report.stats().fixesCommitted(), report.allIssues().size());
        return report;
    }

    private List<Judge> activeJudges() {
        List<Judge> judges = new ArrayList<>();
        judges.add(answerJudge);
        judges.add(qualityJudge);
        if (properties.isStructureJudgeEnabled()) {
            judges.add(structureJudge);
        }
        return judges;
    }

    /**
     * Fan-out on the judge pool, fan-in against one shared deadline. A judge that misses
     * the deadline, throws, is rejected by the pool or is cancelled degrades to AGENT_ERROR.
     */
    private void runJudges(ValidationPipelineContext ctx, CancellationToken token) {
        ctx.setStage(Stage.JUDGING);
        List<Judge> judges = activeJudges();
        log.info("[Validation] Judging {} items with {}", ctx.getItems().size(),
                judges.stream().map(Judge::name).toList());

        List<GeneratedItem> items = ctx.getItems();
        DomainContext domainContext = ctx.getDomainContext();

        List<Future<JudgeResult>> futures = new ArrayList<>(judges.size());
        for (Judge judge : judges) {
            futures.add(runner.submit(() -> judge.run(items, domainContext), token));
        }

        long deadline = runner.deadline();
        List<JudgeResult> results = new ArrayList<>(judges.size());
        for (int i = 0; i < judges.size(); i++) {
            results.add(runner.awaitJudge(judges.get(i).name(), futures.get(i), deadline));
        }
        ctx.setJudgeResults(results);
    }

    /**
     * One fixer call at a time, in selection order, always with the candidate's first issue.
     * Outcomes are visible on the context as soon as they exist.
     */
    private void repair(ValidationPipelineContext ctx, CancellationToken token) {
        ctx.setStage(Stage.REPAIRING);
        List<RemediationCandidate> candidates = ctx.getCandidates();
        log.info("[Validation] Repairing {} items: {}", candidates.size(),
                candidates.stream().map(RemediationCandidate::itemIndex).toList());

        List<FixOutcome> outcomes = new ArrayList<>();
        ctx.setFixOutcomes(outcomes);
        for (RemediationCandidate candidate : candidates) {
            if (token.isCancelled()) {
                log.info("[Validation] Run cancelled, stopping repairs after {} attempts", outcomes.size());
                break;
            }
            FixOutcome outcome = fix(ctx, candidate, token);
            outcomes.add(outcome);
            ctx.setFixAttempts(outcomes.size());
            ctx.addRemediationUsage(outcome.usage());
            if (!outcome.success()) {
                log.warn("[Validation] Fix failed for item {}: {}", candidate.itemIndex(), outcome.error());
            }
        }
    }

    private FixOutcome fix(ValidationPipelineContext ctx, RemediationCandidate candidate, CancellationToken token) {
        int index = candidate.itemIndex();
        GeneratedItem original = ctx.getItems().get(index);
        try {
            FixOutcome outcome = runner.call(
                    () -> fixer.fix(index, original, candidate.primaryIssue(), ctx.getDomainContext()), token);
            return outcome != null ? outcome : FixOutcome.failed(index, "Fixer returned nothing", OracleUsage.NONE);
        } catch (TimeoutException e) {
            return FixOutcome.failed(index, "Fix timed out after " + runner.timeoutSeconds() + "s", OracleUsage.NONE);
        } catch (CancellationException e) {
            return FixOutcome.failed(index, "Run cancelled", OracleUsage.NONE);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Validation] Fixer failed unexpectedly on item {}", index, cause);
            return FixOutcome.failed(index, "Fix failed: " + cause.getMessage(), OracleUsage.NONE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FixOutcome.failed(index, "Fix interrupted", OracleUsage.NONE);
        }
    }

    private void reverify(ValidationPipelineContext ctx, CancellationToken token) {
        ctx.setStage(Stage.REVERIFYING);
        if (token.isCancelled()) {
            List<FixOutcome> discarded = ctx.getFixOutcomes().stream()
                    .map(o -> o.success() ? o.reverted("Run cancelled") : o)
                    .toList();
            ctx.setFixOutcomes(new ArrayList<>(discarded));
            return;
        }

        ReverificationGate.GateResult gateResult = gate.reverify(
                ctx.getFixOutcomes(), ctx.getFinalItems(), ctx.getDomainContext(), token);
        ctx.setFixOutcomes(new ArrayList<>(gateResult.outcomes()));
        ctx.setFixesCommitted(gateResult.committedIndices().size());
        ctx.setFixesReverted(gateResult.revertedIndices().size());
        ctx.addRemediationUsage(gateResult.usage());
    }
}

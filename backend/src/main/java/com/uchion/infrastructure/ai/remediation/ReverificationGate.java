package com.uchion.infrastructure.ai.remediation;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.pipeline.CancellationToken;
import com.uchion.infrastructure.ai.pipeline.OracleCallRunner;
import com.uchion.infrastructure.ai.validation.AnswerJudge;
import com.uchion.infrastructure.config.ValidationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Second phase of remediation: every proposed replacement is re-checked for answer
 * correctness in one batched call, and only replacements that pass are committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReverificationGate {

    static final String UNVERIFIED_SUFFIX = " (не перепроверено)";
    static final String REVERT_PREFIX = "Исправление отклонено при перепроверке: ";
    static final String UNVERIFIED_REVERT = "Исправление отклонено: перепроверка недоступна";

    private final AnswerJudge answerJudge;
    private final OracleCallRunner runner;
    private final ValidationProperties properties;

    /**
     * @param outcomes          rewritten outcome list, same order as the input
     * @param committedIndices  item indices whose replacement was written to the batch
     * @param revertedIndices   item indices whose replacement was rejected
     * @param usage             cost of the re-verification call
     */
    public record GateResult(List<FixOutcome> outcomes,
                             List<Integer> committedIndices,
                             List<Integer> revertedIndices,
                             OracleUsage usage) {}

    public GateResult reverify(List<FixOutcome> outcomes, List<GeneratedItem> finalItems, DomainContext context) {
        return reverify(outcomes, finalItems, context, CancellationToken.none());
    }

    /**
     * Re-checks successful repairs and applies the ones that pass to {@code finalItems}.
     *
     * @param outcomes   fixer outcomes in selection order
     * @param finalItems mutable copy of the batch; only committed indices are written
     * @param token      the re-check call is registered with it; once cancelled, nothing is committed
     */
    public GateResult reverify(List<FixOutcome> outcomes, List<GeneratedItem> finalItems,
                               DomainContext context, CancellationToken token) {
        List<Integer> positions = new ArrayList<>();
        List<GeneratedItem> proposals = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            if (outcomes.get(i).success()) {
                positions.add(i);
                proposals.add(outcomes.get(i).fixedItem());
            }
        }

        if (proposals.isEmpty()) {
            return new GateResult(List.copyOf(outcomes), List.of(), List.of(), OracleUsage.NONE);
        }

        log.info("[ReverificationGate] Re-checking {} repaired items in one call", proposals.size());
        JudgeResult recheck = runner.awaitJudge(AnswerJudge.NAME,
                runner.submit(() -> answerJudge.run(proposals, context), token), runner.deadline());

        if (token.isCancelled()) {
            log.info("[ReverificationGate] Run cancelled, discarding {} repairs", proposals.size());
            List<FixOutcome> discarded = new ArrayList<>(outcomes);
            for (int position : positions) {
                discarded.set(position, outcomes.get(position).reverted("Run cancelled"));
            }
            return new GateResult(discarded, List.of(), List.of(), recheck.usage());
        }

        Map<Integer, ItemVerdict> verdictByCandidate = new HashMap<>();
        for (ItemVerdict verdict : recheck.itemVerdicts()) {
            verdictByCandidate.putIfAbsent(verdict.itemIndex(), verdict);
        }

        List<FixOutcome> rewritten = new ArrayList<>(outcomes);
        List<Integer> committed = new ArrayList<>();
        List<Integer> reverted = new ArrayList<>();
        boolean revertUnverified = properties.getRemediation().isRevertUnverified();

        for (int j = 0; j < positions.size(); j++) {
            int position = positions.get(j);
            FixOutcome outcome = outcomes.get(position);

            if (!recheck.isAvailable()) {
                if (revertUnverified) {
                    rewritten.set(position, outcome.reverted(UNVERIFIED_REVERT));
                    reverted.add(outcome.itemIndex());
                } else {
                    rewritten.set(position, outcome.withDescription(outcome.description() + UNVERIFIED_SUFFIX));
                    finalItems.set(outcome.itemIndex(), outcome.fixedItem());
                    committed.add(outcome.itemIndex());
                }
                continue;
            }

            ItemVerdict verdict = verdictByCandidate.get(j);
            if (verdict != null && verdict.status() == VerdictStatus.ERROR) {
                String reason = REVERT_PREFIX + verdict.issues().get(0).message();
                rewritten.set(position, outcome.reverted(reason));
                reverted.add(outcome.itemIndex());
            } else {
                finalItems.set(outcome.itemIndex(), outcome.fixedItem());
                committed.add(outcome.itemIndex());
            }
        }

        if (!recheck.isAvailable()) {
            log.warn("[ReverificationGate] Judge unavailable ({}), {} repairs {}",
                    recheck.outcome().reason(), positions.size(), revertUnverified ? "reverted" : "committed unverified");
        }
        if (!reverted.isEmpty()) {
            log.warn("[ReverificationGate] Reverted repairs of items {}", reverted);
        }
        log.info("[ReverificationGate] Committed {} repairs, reverted {}", committed.size(), reverted.size());
        return new GateResult(rewritten, committed, reverted, recheck.usage());
    }
}

package com.uchion.infrastructure.ai.remediation;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.infrastructure.ai.pipeline.CancellationToken;
import com.uchion.infrastructure.ai.pipeline.OracleCallRunner;
import com.uchion.infrastructure.ai.validation.AnswerJudge;
import com.uchion.infrastructure.config.ValidationProperties;
import com.uchion.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReverificationGateTest {

    @Mock
    private AnswerJudge answerJudge;

    private ValidationProperties properties;
    private ReverificationGate gate;

    private List<GeneratedItem> originals;
    private List<GeneratedItem> finalItems;
    private final GeneratedItem fixed1 = TestItems.singleChoice("Исправленное задание номер один?", 1);
    private final GeneratedItem fixed3 = TestItems.singleChoice("Исправленное задание номер три?", 2);

    @BeforeEach
    void setUp() {
        properties = new ValidationProperties();
        gate = gateOn(new TaskExecutorAdapter(Runnable::run));
        originals = TestItems.batch(4);
        finalItems = new ArrayList<>(originals);
    }

    private ReverificationGate gateOn(TaskExecutorAdapter executor) {
        return new ReverificationGate(answerJudge, new OracleCallRunner(executor, properties), properties);
    }

    private List<FixOutcome> outcomes() {
        return List.of(
                FixOutcome.fixed(1, fixed1, "WRONG_ANSWER: исправлено", OracleUsage.NONE),
                FixOutcome.failed(2, "No JSON in oracle response", OracleUsage.NONE),
                FixOutcome.fixed(3, fixed3, "BAD_FORMULATION: исправлено", OracleUsage.NONE));
    }

    @Test
    @DisplayName("one batched call with only the replacements, verdict j maps to candidate j")
    void commitsAndReverts() {
        when(answerJudge.run(eq(List.of(fixed1, fixed3)), eq(TestItems.MATH_5)))
                .thenReturn(JudgeResult.checked("answer-verifier", List.of(
                        ItemVerdict.ok(0),
                        ItemVerdict.of(1, VerdictStatus.ERROR, new Issue(IssueCode.WRONG_ANSWER, "Ответ снова неверен"))),
                        new OracleUsage(50, 10)));

        ReverificationGate.GateResult result = gate.reverify(outcomes(), finalItems, TestItems.MATH_5);

        verify(answerJudge, times(1)).run(any(), any());
        assertThat(result.committedIndices()).containsExactly(1);
        assertThat(result.revertedIndices()).containsExactly(3);
        assertThat(finalItems.get(1)).isEqualTo(fixed1);
        assertThat(finalItems.get(3)).isEqualTo(originals.get(3));
        assertThat(result.outcomes().get(2).success()).isFalse();
        assertThat(result.outcomes().get(2).fixedItem()).isNull();
        assertThat(result.outcomes().get(2).error()).contains("Ответ снова неверен");
        assertThat(result.outcomes().get(1)).isEqualTo(outcomes().get(1));
        assertThat(result.usage()).isEqualTo(new OracleUsage(50, 10));
    }

    @Test
    @DisplayName("no successful repair: no call")
    void nothingToCheck() {
        List<FixOutcome> failed = List.of(FixOutcome.failed(0, "No API key", OracleUsage.NONE));

        ReverificationGate.GateResult result = gate.reverify(failed, finalItems, TestItems.MATH_5);

        verifyNoInteractions(answerJudge);
        assertThat(result.outcomes()).isEqualTo(failed);
        assertThat(finalItems).isEqualTo(originals);
    }

    @Test
    @DisplayName("unavailable judge: repairs committed and marked unverified")
    void unavailableCommits() {
        when(answerJudge.run(any(), any()))
                .thenReturn(JudgeResult.unavailable("answer-verifier", IssueCode.AGENT_ERROR));

        ReverificationGate.GateResult result = gate.reverify(outcomes(), finalItems, TestItems.MATH_5);

        assertThat(result.committedIndices()).containsExactly(1, 3);
        assertThat(finalItems.get(3)).isEqualTo(fixed3);
        assertThat(result.outcomes().get(0).description()).endsWith(ReverificationGate.UNVERIFIED_SUFFIX);
    }

    @Test
    @DisplayName("unavailable judge with revert-unverified: repairs reverted")
    void unavailableReverts() {
        properties.getRemediation().setRevertUnverified(true);
        when(answerJudge.run(any(), any()))
                .thenReturn(JudgeResult.unavailable("answer-verifier", IssueCode.NO_CREDENTIALS));

        ReverificationGate.GateResult result = gate.reverify(outcomes(), finalItems, TestItems.MATH_5);

        assertThat(result.revertedIndices()).containsExactly(1, 3);
        assertThat(finalItems).isEqualTo(originals);
        assertThat(result.outcomes()).noneMatch(FixOutcome::success);
    }

    @Test
    @DisplayName("cancelled while re-checking: nothing committed")
    void cancelled() {
        CancellationToken token = new CancellationToken();
        when(answerJudge.run(any(), any())).thenAnswer(inv -> {
            token.cancel();
            return JudgeResult.checked("answer-verifier", List.of(ItemVerdict.ok(0), ItemVerdict.ok(1)),
                    OracleUsage.NONE);
        });

        ReverificationGate.GateResult result = gate.reverify(outcomes(), finalItems, TestItems.MATH_5, token);

        assertThat(result.committedIndices()).isEmpty();
        assertThat(finalItems).isEqualTo(originals);
        assertThat(result.outcomes()).noneMatch(FixOutcome::success);
    }

    @Test
    @DisplayName("re-check slower than the judge timeout is interrupted and treated as unverified")
    void recheckTimesOut() throws InterruptedException {
        properties.setJudgeTimeoutSeconds(1);
        properties.getRemediation().setRevertUnverified(true);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(answerJudge.run(any(), any())).thenAnswer(inv -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return JudgeResult.checked("answer-verifier", List.of(ItemVerdict.ok(0), ItemVerdict.ok(1)),
                    OracleUsage.NONE);
        });
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            long start = System.currentTimeMillis();

            ReverificationGate.GateResult result = gateOn(new TaskExecutorAdapter(pool))
                    .reverify(outcomes(), finalItems, TestItems.MATH_5);

            assertThat(System.currentTimeMillis() - start).isLessThan(4000);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(result.revertedIndices()).containsExactly(1, 3);
            assertThat(result.outcomes().get(0).error()).isEqualTo(ReverificationGate.UNVERIFIED_REVERT);
            assertThat(finalItems).isEqualTo(originals);
        } finally {
            pool.shutdownNow();
        }
    }
}

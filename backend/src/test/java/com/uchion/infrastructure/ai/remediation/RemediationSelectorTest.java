package com.uchion.infrastructure.ai.remediation;

import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.DomainContext;
import com.uchion.domain.worksheet.model.Subject;
import com.uchion.infrastructure.config.ValidationProperties;
import com.uchion.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RemediationSelectorTest {

    private ValidationProperties properties;
    private RemediationSelector selector;

    @BeforeEach
    void setUp() {
        properties = new ValidationProperties();
        selector = new RemediationSelector(properties);
    }

    private static ItemVerdict verdict(int index, VerdictStatus status, IssueCode code) {
        return ItemVerdict.of(index, status, new Issue(code, code.name()));
    }

    private static List<Integer> indices(RemediationWorklist worklist) {
        return worklist.candidates().stream().map(RemediationCandidate::itemIndex).toList();
    }

    @Test
    @DisplayName("error item and remediable warning are both selected, error first")
    void errorAndRemediableWarning() {
        JudgeResult answers = JudgeResult.checked("answer-verifier",
                List.of(verdict(2, VerdictStatus.ERROR, IssueCode.WRONG_ANSWER)), OracleUsage.NONE);
        JudgeResult quality = JudgeResult.checked("unified-checker",
                List.of(verdict(4, VerdictStatus.WARNING, IssueCode.DIFFICULTY_MISMATCH)), OracleUsage.NONE);

        RemediationWorklist worklist = selector.select(List.of(answers, quality), TestItems.MATH_5);

        assertThat(indices(worklist)).containsExactly(2, 4);
        assertThat(worklist.candidates().get(0).hasError()).isTrue();
        assertThat(worklist.candidates().get(1).primaryIssue().code()).isEqualTo(IssueCode.DIFFICULTY_MISMATCH);
    }

    @Test
    @DisplayName("warnings with other codes are not repaired")
    void plainWarningsExcluded() {
        JudgeResult quality = JudgeResult.checked("unified-checker",
                List.of(verdict(1, VerdictStatus.WARNING, IssueCode.PARTIAL_MISMATCH),
                        verdict(3, VerdictStatus.WARNING, IssueCode.FEW_OPTIONS)),
                OracleUsage.NONE);

        assertThat(selector.select(List.of(quality), TestItems.MATH_5).candidates()).isEmpty();
    }

    @Test
    @DisplayName("warning-only items come after every error item")
    void errorItemsFirst() {
        JudgeResult quality = JudgeResult.checked("unified-checker",
                List.of(verdict(0, VerdictStatus.WARNING, IssueCode.DIFFICULTY_MISMATCH),
                        verdict(6, VerdictStatus.ERROR, IssueCode.BAD_FORMULATION),
                        verdict(3, VerdictStatus.ERROR, IssueCode.OFF_TOPIC)),
                OracleUsage.NONE);

        assertThat(indices(selector.select(List.of(quality), TestItems.MATH_5))).containsExactly(3, 6, 0);
    }

    @Test
    @DisplayName("issues of one item keep judge order, first judge's issue is primary")
    void primaryIssueFollowsJudgeOrder() {
        JudgeResult answers = JudgeResult.checked("answer-verifier",
                List.of(verdict(1, VerdictStatus.ERROR, IssueCode.WRONG_ANSWER)), OracleUsage.NONE);
        JudgeResult quality = JudgeResult.checked("unified-checker",
                List.of(verdict(1, VerdictStatus.ERROR, IssueCode.BAD_FORMULATION)), OracleUsage.NONE);

        RemediationCandidate candidate = selector.select(List.of(answers, quality), TestItems.MATH_5)
                .candidates().get(0);

        assertThat(candidate.issues()).extracting(Issue::code)
                .containsExactly(IssueCode.WRONG_ANSWER, IssueCode.BAD_FORMULATION);
        assertThat(candidate.primaryIssue().code()).isEqualTo(IssueCode.WRONG_ANSWER);
    }

    @Test
    @DisplayName("budget caps the selection, the rest is left unrepaired")
    void budgetCap() {
        properties.getRemediation().setBudget(10);
        List<ItemVerdict> verdicts = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            verdicts.add(verdict(i, VerdictStatus.ERROR, IssueCode.WRONG_ANSWER));
        }
        JudgeResult answers = JudgeResult.checked("answer-verifier", verdicts, OracleUsage.NONE);

        RemediationWorklist worklist = selector.select(List.of(answers), TestItems.MATH_5);

        assertThat(worklist.candidates()).hasSize(10);
        assertThat(worklist.droppedIndices()).containsExactly(10, 11, 12, 13);
    }

    @Test
    @DisplayName("excluded subject yields an empty selection")
    void excludedSubject() {
        properties.getRemediation().setExcludedSubjects(EnumSet.of(Subject.RUSSIAN));
        DomainContext russian = new DomainContext(Subject.RUSSIAN, 6, "Имя прилагательное", null);
        JudgeResult answers = JudgeResult.checked("answer-verifier",
                List.of(verdict(0, VerdictStatus.ERROR, IssueCode.WRONG_ANSWER)), OracleUsage.NONE);

        assertThat(selector.select(List.of(answers), russian).candidates()).isEmpty();
        assertThat(selector.select(List.of(answers), TestItems.MATH_5).candidates()).hasSize(1);
    }

    @Test
    @DisplayName("degraded judges contribute nothing")
    void degradedJudge() {
        JudgeResult degraded = JudgeResult.unavailable("answer-verifier", IssueCode.AGENT_ERROR);

        assertThat(selector.select(List.of(degraded), TestItems.MATH_5).candidates()).isEmpty();
    }
}

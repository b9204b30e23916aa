package com.uchion.infrastructure.ai.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uchion.domain.curriculum.CurriculumLookup;
import com.uchion.domain.validation.model.*;
import com.uchion.domain.worksheet.model.GeneratedItem;
import com.uchion.domain.worksheet.model.Subject;
import com.uchion.infrastructure.ai.LlmCallResult;
import com.uchion.infrastructure.ai.ModelRouter;
import com.uchion.infrastructure.ai.OracleClient;
import com.uchion.support.TestItems;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QualityContentJudgeTest {

    @Mock
    private OracleClient oracleClient;

    @Mock
    private ModelRouter modelRouter;

    @Mock
    private CurriculumLookup curriculumLookup;

    private QualityContentJudge judge;

    private final List<GeneratedItem> items = TestItems.batch(5);

    @BeforeEach
    void setUp() {
        judge = new QualityContentJudge(oracleClient, new ResponseSanitizer(new ObjectMapper()), modelRouter,
                new JudgePromptCatalog(), new ItemPromptFormatter(), curriculumLookup);
    }

    private void oracleAnswers(String content) {
        when(oracleClient.isConfigured()).thenReturn(true);
        when(modelRouter.qualityJudgeModel()).thenReturn("agents-model");
        when(oracleClient.callWithModel(eq("unified_checker"), eq("agents-model"), anyString(), anyString(),
                anyDouble(), anyInt()))
                .thenReturn(new LlmCallResult(content, "agents-model", 200, 40));
    }

    @Test
    @DisplayName("codes and suggestions are mapped per entry")
    void mapsCodes() {
        when(curriculumLookup.topicsFor(Subject.MATH, 5)).thenReturn(Optional.of(List.of("Обыкновенные дроби")));
        oracleAnswers("""
                {"tasks": [
                  {"index": 0, "status": "ok"},
                  {"index": 1, "status": "error", "code": "OFF_TOPIC", "issue": "Задание про проценты"},
                  {"index": 2, "status": "warning", "code": "PARTIAL_MISMATCH", "issue": "Термин из 7 класса"},
                  {"index": 4, "status": "warning", "code": "DIFFICULTY_MISMATCH", "issue": "Слишком легко"}
                ]}""");

        JudgeResult result = judge.run(items, TestItems.MATH_5);

        assertThat(result.totalErrors()).isEqualTo(1);
        assertThat(result.totalWarnings()).isEqualTo(2);
        assertThat(result.verdicts()).extracting(v -> v.issues().isEmpty() ? null : v.issues().get(0).code())
                .containsExactly(null, IssueCode.OFF_TOPIC, IssueCode.PARTIAL_MISMATCH, IssueCode.DIFFICULTY_MISMATCH);
        assertThat(result.verdicts().get(1).issues().get(0).suggestion())
                .isEqualTo("Пересгенерировать задание по указанной теме");
        assertThat(result.verdicts().get(3).issues().get(0).suggestion())
                .isEqualTo("Скорректировать сложность задания");
    }

    @Test
    @DisplayName("missing or unknown code falls back by status")
    void defaultsByStatus() {
        when(curriculumLookup.topicsFor(any(), anyInt())).thenReturn(Optional.empty());
        oracleAnswers("""
                {"tasks": [
                  {"index": 0, "status": "error", "issue": "Нет правильного варианта"},
                  {"index": 1, "status": "warning", "issue": "Легковато"},
                  {"index": 2, "status": "error", "code": "WRONG_ANSWER", "issue": "?"},
                  {"index": 3, "status": "error", "code": "SOMETHING_ELSE", "issue": "?"}
                ]}""");

        JudgeResult result = judge.run(items, TestItems.MATH_5);

        assertThat(result.verdicts()).extracting(v -> v.issues().get(0).code())
                .containsExactly(IssueCode.BAD_FORMULATION, IssueCode.DIFFICULTY_MISMATCH,
                        IssueCode.BAD_FORMULATION, IssueCode.BAD_FORMULATION);
        assertThat(result.verdicts().get(0).issues().get(0).suggestion())
                .isEqualTo("Переформулировать задание или исправить варианты ответов");
    }

    @Test
    @DisplayName("prompt has domain context, curriculum placeholder and no answers")
    void promptContent() {
        when(curriculumLookup.topicsFor(Subject.MATH, 5)).thenReturn(Optional.empty());
        oracleAnswers("{\"tasks\": []}");

        judge.run(items, TestItems.MATH_5);

        ArgumentCaptor<String> userMessage = ArgumentCaptor.forClass(String.class);
        verify(oracleClient).callWithModel(anyString(), anyString(), anyString(), userMessage.capture(),
                anyDouble(), anyInt());
        assertThat(userMessage.getValue())
                .contains("Класс: 5")
                .contains("Тема: \"Обыкновенные дроби\"")
                .contains("Средний")
                .contains("Темы программы 5 класса: не найдены")
                .contains("Индексы от 0 до 4")
                .doesNotContain("Указанный правильный ответ");
    }

    @Test
    @DisplayName("unavailable result keeps the judge name")
    void unavailableName() {
        when(oracleClient.isConfigured()).thenReturn(false);

        JudgeResult result = judge.run(items, TestItems.MATH_5);

        assertThat(result.judgeName()).isEqualTo("unified-checker");
        assertThat(result.outcome().reason()).isEqualTo(IssueCode.NO_CREDENTIALS);
    }
}

package com.uchion.infrastructure.ai;

import com.openai.client.OpenAIClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OracleClientTest {

    @Mock
    private OpenAIClient openAIClient;

    @Mock
    private UsageTracker usageTracker;

    private OracleClient oracleClient;

    @BeforeEach
    void setUp() {
        oracleClient = new OracleClient(openAIClient, usageTracker);
        ReflectionTestUtils.setField(oracleClient, "temperature", 0.1);
        ReflectionTestUtils.setField(oracleClient, "maxTokens", 4000);
    }

    @Test
    @DisplayName("configured only with a non-blank key")
    void isConfigured() {
        ReflectionTestUtils.setField(oracleClient, "apiKey", " ");
        assertThat(oracleClient.isConfigured()).isFalse();

        ReflectionTestUtils.setField(oracleClient, "apiKey", "sk-test");
        assertThat(oracleClient.isConfigured()).isTrue();
    }

    @Test
    @DisplayName("SDK failures are wrapped in OracleException")
    void wrapsFailures() {
        when(openAIClient.chat()).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> oracleClient.callWithModel("answer_verifier", "model", "system", "user", -1, -1))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("connection refused")
                .hasCauseInstanceOf(IllegalStateException.class);
        verifyNoInteractions(usageTracker);
    }
}

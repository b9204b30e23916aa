package com.uchion.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Pure LLM call wrapper shared by every judge and the fixer.
 * Prompt construction and response decoding live with the callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OracleClient {

    private final OpenAIClient openAIClient;
    private final UsageTracker usageTracker;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.max-tokens:4000}")
    private int maxTokens;

    /**
     * Whether credentials are present. Callers degrade instead of calling when this is false.
     */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * OpenAI-compatible chat completion with explicit model name and token usage tracking.
     *
     * @param callType     accounting label, e.g. "answer_verifier"
     * @param modelName    model identifier as understood by the configured endpoint
     * @param systemPrompt system prompt
     * @param userMessage  user message
     * @param temp         temperature (-1 to use default)
     * @param maxTok       max completion tokens (-1 to use default)
     * @throws OracleException on any transport or API failure, or an empty answer
     */
    public LlmCallResult callWithModel(String callType, String modelName, String systemPrompt,
                                       String userMessage, double temp, int maxTok) {
        double actualTemp = temp < 0 ? temperature : temp;
        int actualMaxTok = maxTok < 0 ? maxTokens : maxTok;
        long start = System.currentTimeMillis();

        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(modelName)
                    .temperature(actualTemp)
                    .maxCompletionTokens(actualMaxTok)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("Token usage [{}|{}] - prompt: {}, completion: {}, total: {}",
                        callType, modelName, promptTokens, completionTokens, usage.totalTokens());
                usageTracker.recordUsage(callType, modelName, promptTokens, completionTokens,
                        System.currentTimeMillis() - start);
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new OracleException("Oracle response has no content"));

            return new LlmCallResult(content.trim(), modelName, promptTokens, completionTokens);
        } catch (OracleException e) {
            throw e;
        } catch (Exception e) {
            log.error("Oracle call failed [{}|{}] after {}ms", callType, modelName,
                    System.currentTimeMillis() - start, e);
            throw new OracleException("Oracle call failed: " + e.getMessage(), e);
        }
    }
}

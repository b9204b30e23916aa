package com.uchion.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class OpenAiConfig {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.base-url:}")
    private String baseUrl;

    @Value("${openai.timeout-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public OpenAIClient openAIClient() {
        var builder = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .maxRetries(1)
                .timeout(Duration.ofSeconds(timeoutSeconds));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}

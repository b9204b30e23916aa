package com.uchion.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative oracle usage per call type, with an estimated cost for external accounting.
 * Prices are RUB per 1M tokens; costs are reported in kopecks.
 */
@Slf4j
@Component
public class UsageTracker {

    record ModelPrice(double inputPer1M, double outputPer1M) {}

    static final Map<String, ModelPrice> MODEL_PRICING = Map.of(
            "openai/gpt-4.1", new ModelPrice(168.23, 672.92),
            "openai/gpt-4.1-mini", new ModelPrice(33.65, 134.58),
            "google/gemini-3-flash-preview", new ModelPrice(168.23, 1009.38),
            "google/gemini-2.5-flash-lite", new ModelPrice(8.41, 33.65),
            "deepseek/deepseek-v3.2", new ModelPrice(21.87, 31.96)
    );

    private static final ModelPrice DEFAULT_PRICE = new ModelPrice(100, 400);

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicLong totalCostKopecks = new AtomicLong();
    private final Map<String, AtomicLong> requestsByCallType = new ConcurrentHashMap<>();

    public void recordUsage(String callType, String model, long promptTokens, long completionTokens, long durationMs) {
        long cost = costKopecks(model, promptTokens, completionTokens);
        totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
        totalCostKopecks.addAndGet(cost);
        requestsByCallType.computeIfAbsent(callType, k -> new AtomicLong()).incrementAndGet();

        log.info("Usage - {} [{}]: prompt={}, completion={}, cost={} kop, duration={}ms, " +
                        "cumulative: requests={}, cost={} kop",
                callType, model, promptTokens, completionTokens, cost, durationMs,
                totalRequests.get(), totalCostKopecks.get());
    }

    public static long costKopecks(String model, long promptTokens, long completionTokens) {
        ModelPrice price = MODEL_PRICING.getOrDefault(model, DEFAULT_PRICE);
        double rub = promptTokens / 1_000_000.0 * price.inputPer1M()
                + completionTokens / 1_000_000.0 * price.outputPer1M();
        return Math.round(rub * 100);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalCostKopecks() {
        return totalCostKopecks.get();
    }

    public long getRequests(String callType) {
        AtomicLong count = requestsByCallType.get(callType);
        return count == null ? 0 : count.get();
    }
}

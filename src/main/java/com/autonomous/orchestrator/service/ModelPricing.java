package com.autonomous.orchestrator.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Per-million-token list prices, input then output, in USD.
 */
@Component
public class ModelPricing {

    private static final Map<String, double[]> MODEL_PRICING = Map.of(
        "haiku", new double[]{0.25, 1.25},
        "sonnet", new double[]{3.0, 15.0},
        "opus", new double[]{15.0, 75.0}
    );

    // rough average for English text and code
    private static final int CHARS_PER_TOKEN = 4;

    public double calculateCost(String model, long inputTokens, long outputTokens) {
        double[] pricing = MODEL_PRICING.get(family(model));
        double inputCost = (inputTokens * pricing[0]) / 1_000_000.0;
        double outputCost = (outputTokens * pricing[1]) / 1_000_000.0;
        return inputCost + outputCost;
    }

    public long estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    String family(String model) {
        String name = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (name.contains("opus")) {
            return "opus";
        }
        if (name.contains("haiku")) {
            return "haiku";
        }
        return "sonnet";
    }
}

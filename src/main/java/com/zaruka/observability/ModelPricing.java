package com.zaruka.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * USD per 1M tokens. Versioned model ids (gpt-4o-2024-05-13) resolve by prefix;
 * unknown models are assumed self-hosted and free.
 */
public final class ModelPricing {

    private static final double[] FREE = {0, 0};

    // longer keys first so prefix lookup prefers the most specific entry
    private static final Map<String, double[]> PRICING = new LinkedHashMap<>();

    static {
        PRICING.put("claude-opus-4-6", new double[]{15.00, 75.00});
        PRICING.put("claude-sonnet-4-5", new double[]{3.00, 15.00});
        PRICING.put("claude-haiku-4-5", new double[]{0.80, 4.00});
        PRICING.put("gpt-4o-mini", new double[]{0.15, 0.60});
        PRICING.put("gpt-4o", new double[]{2.50, 10.00});
        PRICING.put("gpt-4-turbo-preview", new double[]{10.00, 30.00});
        PRICING.put("gpt-4-turbo", new double[]{10.00, 30.00});
        PRICING.put("gpt-4", new double[]{30.00, 60.00});
        PRICING.put("gpt-3.5-turbo", new double[]{0.50, 1.50});
        PRICING.put("o1-mini", new double[]{3.00, 12.00});
        PRICING.put("o1", new double[]{15.00, 60.00});
        PRICING.put("o3-mini", new double[]{1.10, 4.40});
        PRICING.put("deepseek-chat", new double[]{0.14, 0.28});
        for (var free : new String[]{"llama", "mistral", "mixtral", "qwen", "phi", "gemma"}) {
            PRICING.put(free, FREE);
        }
    }

    private ModelPricing() {}

    public static double cost(String model, int inputTokens, int outputTokens) {
        var prices = lookup(model);
        return (inputTokens * prices[0] + outputTokens * prices[1]) / 1_000_000.0;
    }

    private static double[] lookup(String model) {
        if (model == null) return FREE;
        var exact = PRICING.get(model);
        if (exact != null) return exact;
        var lower = model.toLowerCase(Locale.ROOT);
        for (var entry : PRICING.entrySet()) {
            if (lower.startsWith(entry.getKey())) return entry.getValue();
        }
        return FREE;
    }
}

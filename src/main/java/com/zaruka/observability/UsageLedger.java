package com.zaruka.observability;

import com.zaruka.shared.model.UsageEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory running totals per model. Durable storage is left to whoever
 * wraps or replaces this recorder.
 */
public class UsageLedger implements UsageRecorder {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    private final Map<String, Totals> byModel = new ConcurrentHashMap<>();

    @Override
    public void report(UsageEvent event) {
        var cost = ModelPricing.cost(event.modelId(), event.inputTokens(), event.outputTokens());
        var totals = byModel.computeIfAbsent(event.modelId(), k -> new Totals());
        totals.calls.increment();
        totals.inputTokens.add(event.inputTokens());
        totals.outputTokens.add(event.outputTokens());
        totals.costUsd.add(cost);
        log.debug("Usage model={} in={} out={} cost=${}", event.modelId(),
                event.inputTokens(), event.outputTokens(), String.format("%.6f", cost));
    }

    public Map<String, Object> summary() {
        long calls = 0, in = 0, out = 0;
        double cost = 0;
        for (var t : byModel.values()) {
            calls += t.calls.sum();
            in += t.inputTokens.sum();
            out += t.outputTokens.sum();
            cost += t.costUsd.sum();
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("calls", calls);
        result.put("inputTokens", in);
        result.put("outputTokens", out);
        result.put("costUsd", cost);
        return result;
    }

    public Map<String, Object> summary(String modelId) {
        var t = byModel.get(modelId);
        if (t == null) return Map.of();
        return Map.of(
                "calls", t.calls.sum(),
                "inputTokens", t.inputTokens.sum(),
                "outputTokens", t.outputTokens.sum(),
                "costUsd", t.costUsd.sum());
    }

    private static final class Totals {
        final LongAdder calls = new LongAdder();
        final LongAdder inputTokens = new LongAdder();
        final LongAdder outputTokens = new LongAdder();
        final DoubleAdder costUsd = new DoubleAdder();
    }
}

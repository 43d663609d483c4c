package com.zaruka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class AssistantMetrics {

    private final MeterRegistry registry;

    public AssistantMetrics() {
        this(new SimpleMeterRegistry());
    }

    public AssistantMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer llmLatency() {
        return Timer.builder("zaruka.llm.latency").register(registry);
    }

    public Counter attempts(String provider) {
        return Counter.builder("zaruka.llm.attempts").tag("provider", provider).register(registry);
    }

    public Counter failovers() {
        return Counter.builder("zaruka.llm.failovers").register(registry);
    }

    public Counter promptTooLongRetries() {
        return Counter.builder("zaruka.llm.prompt_too_long_retries").register(registry);
    }

    /** Attempts that ended with no text, no tool calls and no error. */
    public Counter emptyResponses() {
        return Counter.builder("zaruka.llm.empty_responses").register(registry);
    }

    public Counter toolExecutions(String tool) {
        return Counter.builder("zaruka.tool.executions").tag("tool", tool).register(registry);
    }

    public Counter tokensUsed() {
        return Counter.builder("zaruka.tokens.total").register(registry);
    }
}

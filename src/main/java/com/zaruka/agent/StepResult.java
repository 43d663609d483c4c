package com.zaruka.agent;

import com.zaruka.shared.model.TokenUsage;

/**
 * Outcome of one attempt against one model.
 */
public record StepResult(
    String text,
    boolean usedTools,
    TokenUsage usage
) {}

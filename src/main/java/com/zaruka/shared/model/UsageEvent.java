package com.zaruka.shared.model;

public record UsageEvent(
    String modelId,
    int inputTokens,
    int outputTokens
) {}

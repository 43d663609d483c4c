package com.zaruka.shared.config;

import java.time.Duration;

/**
 * Budgeting and loop limits for the agent core.
 */
public record AgentSettings(
    int maxContextTokens,
    int responseReserve,
    int tokensPerTool,
    int historyCharLimit,
    int imageTokens,
    int maxRounds,
    Duration requestTimeout,
    String systemPrompt
) {
    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are Zaruka, a personal assistant. \
            Reply in the same language the user uses. \
            Use the provided tools when they help; prefer acting over explaining how to act.""";

    public AgentSettings {
        if (maxRounds < 1) throw new IllegalArgumentException("maxRounds must be >= 1");
        if (maxContextTokens <= responseReserve) {
            throw new IllegalArgumentException("maxContextTokens must exceed responseReserve");
        }
    }

    public static AgentSettings defaults() {
        return new AgentSettings(180_000, 8_000, 200, 1_000, 1_500, 10,
                Duration.ofSeconds(120), DEFAULT_SYSTEM_PROMPT);
    }

    public AgentSettings withSystemPrompt(String prompt) {
        return new AgentSettings(maxContextTokens, responseReserve, tokensPerTool, historyCharLimit,
                imageTokens, maxRounds, requestTimeout, prompt);
    }

    public AgentSettings withMaxContextTokens(int tokens) {
        return new AgentSettings(tokens, responseReserve, tokensPerTool, historyCharLimit,
                imageTokens, maxRounds, requestTimeout, systemPrompt);
    }
}

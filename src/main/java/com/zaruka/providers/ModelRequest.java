package com.zaruka.providers;

import com.zaruka.shared.model.ChatMessage;

import java.util.List;

/**
 * One round's worth of input for a model handle.
 */
public record ModelRequest(
    String systemPrompt,
    List<ChatMessage> messages,
    List<ToolDefinition> tools,
    int maxOutputTokens
) {
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 8_000;

    public ModelRequest {
        messages = List.copyOf(messages);
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public ModelRequest(String systemPrompt, List<ChatMessage> messages) {
        this(systemPrompt, messages, List.of(), DEFAULT_MAX_OUTPUT_TOKENS);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}

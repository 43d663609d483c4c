package com.zaruka.providers;

import com.zaruka.shared.model.TokenUsage;
import com.zaruka.shared.model.ToolCallInfo;

import java.util.List;

/**
 * Output of a single round. {@code error} is set when the provider reported a
 * failure inside an otherwise successful HTTP exchange (e.g. an SSE error event);
 * {@code content} then holds whatever text arrived before it.
 */
public record ModelResponse(
    String model,
    String content,
    TokenUsage usage,
    List<ToolCallInfo> toolCalls,
    RuntimeException error
) {
    public ModelResponse {
        content = content != null ? content : "";
        usage = usage != null ? usage : TokenUsage.ZERO;
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public ModelResponse(String content, TokenUsage usage) {
        this(null, content, usage, List.of(), null);
    }

    public ModelResponse(String content, TokenUsage usage, List<ToolCallInfo> toolCalls) {
        this(null, content, usage, toolCalls, null);
    }

    public static ModelResponse failed(String model, String partialContent, TokenUsage usage, RuntimeException error) {
        return new ModelResponse(model, partialContent, usage, List.of(), error);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasError() {
        return error != null;
    }
}

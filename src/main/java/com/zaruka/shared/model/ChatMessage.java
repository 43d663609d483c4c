package com.zaruka.shared.model;

import java.util.List;

/**
 * Provider-neutral conversation message. Each model handle renders it into its own wire format.
 */
public record ChatMessage(
    Role role,
    List<ContentPart> parts,
    List<ToolCallInfo> toolCalls,
    String toolCallId
) {
    public ChatMessage {
        parts = parts != null ? List.copyOf(parts) : List.of();
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, List.of(new ContentPart.Text(text)), null, null);
    }

    public static ChatMessage user(List<ContentPart> parts) {
        return new ChatMessage(Role.USER, parts, null, null);
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(Role.ASSISTANT, List.of(new ContentPart.Text(text)), null, null);
    }

    public static ChatMessage assistant(String text, List<ToolCallInfo> toolCalls) {
        var parts = text == null || text.isEmpty()
                ? List.<ContentPart>of()
                : List.<ContentPart>of(new ContentPart.Text(text));
        return new ChatMessage(Role.ASSISTANT, parts, toolCalls, null);
    }

    public static ChatMessage toolResult(String toolCallId, String content) {
        return new ChatMessage(Role.TOOL, List.of(new ContentPart.Text(content)), null, toolCallId);
    }

    public static ChatMessage of(Role role, String text) {
        return new ChatMessage(role, List.of(new ContentPart.Text(text)), null, null);
    }

    /** Concatenated text parts; attachments are skipped. */
    public String text() {
        var sb = new StringBuilder();
        for (var part : parts) {
            if (part instanceof ContentPart.Text t) sb.append(t.text());
        }
        return sb.toString();
    }

    public boolean isMultipart() {
        return parts.size() > 1 || parts.stream().anyMatch(p -> !(p instanceof ContentPart.Text));
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}

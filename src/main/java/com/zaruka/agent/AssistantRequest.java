package com.zaruka.agent;

import com.zaruka.shared.model.Attachment;
import com.zaruka.shared.model.ConversationTurn;

import java.util.List;

public record AssistantRequest(
    String userMessage,
    List<ConversationTurn> history,
    List<Attachment> attachments,
    CancellationToken cancellation
) {
    public AssistantRequest {
        if (userMessage == null) {
            throw new IllegalArgumentException("userMessage must not be null");
        }
        history = history != null ? List.copyOf(history) : List.of();
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
        cancellation = cancellation != null ? cancellation : CancellationToken.NONE;
    }

    public static AssistantRequest of(String userMessage) {
        return new AssistantRequest(userMessage, null, null, null);
    }

    public static AssistantRequest of(String userMessage, List<ConversationTurn> history) {
        return new AssistantRequest(userMessage, history, null, null);
    }
}

package com.zaruka.shared.model;

/**
 * One stored turn of a conversation, as supplied by the history store.
 * {@code attachmentDescriptor} is non-null when the original message carried
 * an image or file (e.g. "image" or "file: report.pdf"); the bytes themselves
 * are never kept in history.
 */
public record ConversationTurn(
    Role role,
    String text,
    String attachmentDescriptor
) {
    public ConversationTurn {
        if (role != Role.USER && role != Role.ASSISTANT) {
            throw new IllegalArgumentException("History turns must be user or assistant, got " + role);
        }
        text = text != null ? text : "";
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn(Role.USER, text, null);
    }

    public static ConversationTurn assistant(String text) {
        return new ConversationTurn(Role.ASSISTANT, text, null);
    }

    public boolean hasAttachment() {
        return attachmentDescriptor != null && !attachmentDescriptor.isBlank();
    }
}

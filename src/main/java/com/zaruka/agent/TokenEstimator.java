package com.zaruka.agent;

import com.zaruka.shared.model.Attachment;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ContentPart;

import java.util.Collection;

/**
 * Character-length heuristic: roughly four characters per token.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int estimate(Attachment attachment, int imageTokens) {
        return attachment.isImage() ? imageTokens : fileTokens(attachment.bytes().length);
    }

    public static int estimate(Collection<Attachment> attachments, int imageTokens) {
        int total = 0;
        for (var a : attachments) total += estimate(a, imageTokens);
        return total;
    }

    public static int estimate(ChatMessage message, int imageTokens) {
        int total = 0;
        for (var part : message.parts()) {
            if (part instanceof ContentPart.Text t) total += estimate(t.text());
            else if (part instanceof ContentPart.Image) total += imageTokens;
            else if (part instanceof ContentPart.File f) total += fileTokens(f.bytes().length);
        }
        return total;
    }

    private static int fileTokens(int byteLength) {
        return (byteLength + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}

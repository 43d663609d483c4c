package com.zaruka.shared.model;

import java.util.Objects;

/**
 * Binary payload sent along with the current user turn. Lives for one request only.
 */
public record Attachment(
    Kind kind,
    byte[] bytes,
    String mediaType,
    String fileName
) {
    public enum Kind { IMAGE, FILE }

    public Attachment {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(mediaType, "mediaType");
    }

    public static Attachment image(byte[] bytes, String mediaType) {
        return new Attachment(Kind.IMAGE, bytes, mediaType, null);
    }

    public static Attachment file(byte[] bytes, String mediaType, String fileName) {
        return new Attachment(Kind.FILE, bytes, mediaType, fileName);
    }

    public boolean isImage() {
        return kind == Kind.IMAGE;
    }

    @Override
    public String toString() {
        return "Attachment[" + kind + ", " + mediaType + ", " + bytes.length + " bytes"
                + (fileName != null ? ", " + fileName : "") + "]";
    }
}

package com.zaruka.shared.model;

/**
 * Typed piece of a multi-part user message.
 */
public sealed interface ContentPart permits ContentPart.Text, ContentPart.Image, ContentPart.File {

    record Text(String text) implements ContentPart {}

    record Image(byte[] bytes, String mediaType) implements ContentPart {}

    record File(byte[] bytes, String mediaType, String fileName) implements ContentPart {}

    static ContentPart of(Attachment attachment) {
        return attachment.isImage()
                ? new Image(attachment.bytes(), attachment.mediaType())
                : new File(attachment.bytes(), attachment.mediaType(), attachment.fileName());
    }
}

package dev.receiptly.conversation;

import java.util.Objects;

/**
 * Raw image as delivered with an inbound user turn.
 */
public record ImageAttachment(byte[] content, String mimeType) {

    public ImageAttachment {
        Objects.requireNonNull(content, "content");
        if (content.length == 0) {
            throw new IllegalArgumentException("Image content must not be empty");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("Image MIME type must not be empty");
        }
    }
}

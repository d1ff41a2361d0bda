package dev.receiptly.conversation;

import java.util.Objects;

/**
 * Image uploaded in a turn. The payload is {@code null} once the turn has left the retention window; the
 * reference and MIME type are kept forever.
 */
public record TurnImage(String reference, String mimeType, byte[] payload) {

    public TurnImage {
        Objects.requireNonNull(reference, "reference");
    }

    public boolean isLive() {
        return payload != null;
    }

    TurnImage withoutPayload() {
        return payload == null ? this : new TurnImage(reference, mimeType, null);
    }
}

package dev.receiptly.conversation;

import java.util.Objects;

/**
 * Image bytes recovered for a reference, together with where they were found.
 */
public record ResolvedImage(String reference, String mimeType, byte[] content, Source source) {

    public ResolvedImage {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
    }

    public enum Source {
        /** Payload still live in the session history. */
        CONVERSATION,
        /** Loaded from the blob gateway through the stored receipt's image URI. */
        RECEIPT_STORE
    }
}

package dev.receiptly.storage;

import java.util.Objects;

/**
 * Bytes read back from the blob gateway together with the content type recorded at upload.
 */
public record BlobContent(byte[] content, String contentType) {

    public BlobContent {
        Objects.requireNonNull(content, "content");
    }
}

package dev.receiptly.storage;

/**
 * Object storage for receipt images.
 */
public interface BlobGateway {

    /**
     * Stores the bytes under a name derived from their content. Storing identical bytes twice returns the same URI
     * and leaves the first object untouched.
     *
     * @return stable URI that {@link #get(String)} accepts
     */
    String put(byte[] content, String mimeType);

    /**
     * @throws BlobNotFoundException when nothing is stored under the URI
     */
    BlobContent get(String uri);
}

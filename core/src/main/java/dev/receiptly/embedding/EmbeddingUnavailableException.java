package dev.receiptly.embedding;

/**
 * Signals that the embedding gateway could not produce a vector. Transient from the caller's point of view.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

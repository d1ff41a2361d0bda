package dev.receiptly.tools;

/**
 * Failure categories reported to the model. Only transient gateway and persistence failures are retryable.
 */
public enum ToolErrorCode {

    DUPLICATE_RECEIPT(false),
    INVALID_RANGE(false),
    INVALID_ARGUMENT(false),
    NOT_FOUND(false),
    EMBEDDING_UNAVAILABLE(true),
    GATEWAY_TIMEOUT(true),
    IMAGE_UNAVAILABLE(false),
    STORAGE_FAILURE(true);

    private final boolean retryable;

    ToolErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

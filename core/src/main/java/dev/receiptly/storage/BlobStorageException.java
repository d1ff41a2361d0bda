package dev.receiptly.storage;

public class BlobStorageException extends RuntimeException {

    public BlobStorageException(String message) {
        super(message);
    }

    public BlobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dev.receiptly.storage;

/**
 * Thrown when a blob URI points at an object that no longer exists.
 */
public class BlobNotFoundException extends BlobStorageException {

    private final String uri;

    public BlobNotFoundException(String uri) {
        super("No stored object for " + uri);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}

package dev.receiptly.conversation;

/**
 * Neither the live conversation history nor the receipt store can produce the bytes for a reference.
 */
public class ImageUnavailableException extends RuntimeException {

    private final String reference;

    public ImageUnavailableException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public ImageUnavailableException(String reference, String message, Throwable cause) {
        super(message, cause);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}

package dev.receiptly.receipts;

/**
 * Unexpected failure of the persistence layer behind the receipt store.
 */
public class ReceiptStoreException extends RuntimeException {

    public ReceiptStoreException(String message) {
        super(message);
    }

    public ReceiptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

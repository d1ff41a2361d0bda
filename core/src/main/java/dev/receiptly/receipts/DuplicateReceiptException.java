package dev.receiptly.receipts;

/**
 * Thrown when a receipt with the same content-derived id has already been stored. No data was written.
 */
public class DuplicateReceiptException extends ReceiptStoreException {

    private final String receiptId;

    public DuplicateReceiptException(String receiptId) {
        super("Receipt %s has already been stored".formatted(receiptId));
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }
}

package dev.receiptly.receipts;

public class ReceiptNotFoundException extends RuntimeException {

    private final String receiptId;

    public ReceiptNotFoundException(String receiptId) {
        super("No receipt stored with id " + receiptId);
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }
}

package dev.receiptly.receipts;

/**
 * Caller supplied a time or amount range whose lower bound exceeds its upper bound.
 */
public class InvalidRangeException extends RuntimeException {

    public InvalidRangeException(String message) {
        super(message);
    }
}

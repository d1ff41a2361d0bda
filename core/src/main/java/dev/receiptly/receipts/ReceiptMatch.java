package dev.receiptly.receipts;

import java.util.Objects;

/**
 * Result of a similarity search: the record and its Euclidean distance to the query vector.
 */
public record ReceiptMatch(ReceiptRecord record, double distance) {

    public ReceiptMatch {
        Objects.requireNonNull(record, "record");
    }
}

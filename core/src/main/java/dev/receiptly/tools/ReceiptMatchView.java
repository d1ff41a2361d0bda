package dev.receiptly.tools;

import dev.receiptly.receipts.ReceiptMatch;

public record ReceiptMatchView(ReceiptView receipt, double distance) {

    public static ReceiptMatchView from(ReceiptMatch match) {
        return new ReceiptMatchView(ReceiptView.from(match.record()), match.distance());
    }
}

package dev.receiptly.tools;

import dev.receiptly.receipts.PurchasedItem;
import dev.receiptly.receipts.ReceiptRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Receipt as shown to the model; the embedding vector is left out.
 */
public record ReceiptView(
    String receiptId,
    String storeName,
    Instant transactionTime,
    BigDecimal totalAmount,
    String currency,
    List<PurchasedItem> purchasedItems,
    String imageUri,
    Instant createdAt
) {

    public static ReceiptView from(ReceiptRecord record) {
        return new ReceiptView(record.receiptId(), record.storeName(), record.transactionTime(),
            record.totalAmount(), record.currency(), record.purchasedItems(), record.imageUri(),
            record.createdAt());
    }
}

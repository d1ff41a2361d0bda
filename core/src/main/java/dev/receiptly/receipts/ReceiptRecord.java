package dev.receiptly.receipts;

import dev.receiptly.embedding.EmbeddingVector;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Structured receipt as persisted by the receipt store.
 *
 * @param receiptId       content-derived identifier of the receipt image, the only deduplication key
 * @param storeName       merchant name as printed on the receipt
 * @param transactionTime purchase instant (UTC)
 * @param totalAmount     non-negative total, currency-agnostic magnitude
 * @param currency        ISO-4217 style currency code
 * @param purchasedItems  line items in receipt order
 * @param embedding       vector of the canonical text rendering; {@code null} until stored
 * @param imageUri        blob gateway URI of the receipt image
 * @param createdAt       insertion instant; {@code null} until stored
 */
public record ReceiptRecord(
    String receiptId,
    String storeName,
    Instant transactionTime,
    BigDecimal totalAmount,
    String currency,
    List<PurchasedItem> purchasedItems,
    EmbeddingVector embedding,
    String imageUri,
    Instant createdAt
) {

    public ReceiptRecord {
        Objects.requireNonNull(receiptId, "receiptId");
        Objects.requireNonNull(storeName, "storeName");
        Objects.requireNonNull(transactionTime, "transactionTime");
        Objects.requireNonNull(totalAmount, "totalAmount");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(imageUri, "imageUri");
        purchasedItems = purchasedItems != null ? List.copyOf(purchasedItems) : List.of();
    }

    /**
     * Creates a record that has not been embedded or stored yet.
     */
    public static ReceiptRecord draft(String receiptId, String storeName, Instant transactionTime,
        BigDecimal totalAmount, String currency, List<PurchasedItem> purchasedItems, String imageUri) {
        return new ReceiptRecord(receiptId, storeName, transactionTime, totalAmount, currency, purchasedItems,
            null, imageUri, null);
    }

    public ReceiptRecord withEmbedding(EmbeddingVector vector, Instant insertedAt) {
        return new ReceiptRecord(receiptId, storeName, transactionTime, totalAmount, currency, purchasedItems,
            Objects.requireNonNull(vector, "vector"), imageUri, Objects.requireNonNull(insertedAt, "insertedAt"));
    }
}

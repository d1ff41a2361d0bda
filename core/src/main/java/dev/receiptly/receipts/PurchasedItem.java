package dev.receiptly.receipts;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of a receipt.
 */
public record PurchasedItem(String name, BigDecimal price) {

    public PurchasedItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
    }
}

package dev.receiptly.receipts;

import java.util.StringJoiner;

/**
 * Canonical, deterministic text form of a receipt. Used only as embedding input.
 */
public final class ReceiptTextRenderer {

    private ReceiptTextRenderer() {
        // Utility class
    }

    public static String render(ReceiptRecord record) {
        StringBuilder text = new StringBuilder();
        text.append("Store: ").append(record.storeName().strip()).append('\n');
        if (record.purchasedItems().isEmpty()) {
            text.append("Items: none\n");
        } else {
            StringJoiner items = new StringJoiner("; ", "Items: ", "\n");
            for (PurchasedItem item : record.purchasedItems()) {
                items.add(item.name().strip() + " " + item.price().stripTrailingZeros().toPlainString());
            }
            text.append(items);
        }
        text.append("Total: ")
            .append(record.totalAmount().stripTrailingZeros().toPlainString())
            .append(' ')
            .append(record.currency());
        return text.toString();
    }
}

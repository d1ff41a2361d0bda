package dev.receiptly.receipts;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReceiptTextRendererTest {

    @Test
    void rendersStoreItemsAndTotal() {
        ReceiptRecord record = ReceiptRecord.draft("r1", " Cafe X ", Instant.parse("2024-03-01T10:00:00Z"),
            new BigDecimal("15000.00"), "IDR",
            List.of(new PurchasedItem("Latte", new BigDecimal("10000")), new PurchasedItem("Croissant",
                new BigDecimal("5000.50"))), "memory://receipt-images/r1");

        assertThat(ReceiptTextRenderer.render(record))
            .isEqualTo("Store: Cafe X\nItems: Latte 10000; Croissant 5000.5\nTotal: 15000 IDR");
    }

    @Test
    void rendersReceiptWithoutItems() {
        ReceiptRecord record = ReceiptRecord.draft("r2", "Kiosk", Instant.parse("2024-03-01T10:00:00Z"),
            new BigDecimal("0"), "EUR", null, "memory://receipt-images/r2");

        assertThat(ReceiptTextRenderer.render(record)).isEqualTo("Store: Kiosk\nItems: none\nTotal: 0 EUR");
    }

    @Test
    void ignoresIdentifiersAndTransactionTime() {
        ReceiptRecord first = ReceiptFixtures.draft("a", "Cafe X", "2024-03-01T10:00:00Z", "15000");
        ReceiptRecord second = ReceiptFixtures.draft("b", "Cafe X", "2025-01-01T00:00:00Z", "15000");

        assertThat(ReceiptTextRenderer.render(first)).isEqualTo(ReceiptTextRenderer.render(second));
    }
}

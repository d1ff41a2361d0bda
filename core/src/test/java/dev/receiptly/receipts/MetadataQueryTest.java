package dev.receiptly.receipts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MetadataQueryTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-12-31T23:59:59Z");

    @Test
    void boundsAreInclusive() {
        MetadataQuery query = new MetadataQuery(START, END, new BigDecimal("100"), new BigDecimal("200"));

        assertThat(query.matches(ReceiptFixtures.draft("a", "S", "2024-01-01T00:00:00Z", "100"))).isTrue();
        assertThat(query.matches(ReceiptFixtures.draft("b", "S", "2024-12-31T23:59:59Z", "200.00"))).isTrue();
        assertThat(query.matches(ReceiptFixtures.draft("c", "S", "2025-01-01T00:00:00Z", "150"))).isFalse();
        assertThat(query.matches(ReceiptFixtures.draft("d", "S", "2024-06-01T00:00:00Z", "200.01"))).isFalse();
    }

    @Test
    void nullAmountBoundsAreUnbounded() {
        MetadataQuery query = new MetadataQuery(START, END, null, null);

        assertThat(query.matches(ReceiptFixtures.draft("a", "S", "2024-06-01T00:00:00Z", "0"))).isTrue();
        assertThat(query.matches(ReceiptFixtures.draft("b", "S", "2024-06-01T00:00:00Z", "99999999"))).isTrue();
    }

    @Test
    void rejectsInvertedRanges() {
        assertThatThrownBy(() -> new MetadataQuery(END, START, null, null))
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> new MetadataQuery(START, END, new BigDecimal("10"), new BigDecimal("5")))
            .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void allowsSingleInstantRange() {
        MetadataQuery query = new MetadataQuery(START, START, BigDecimal.ONE, BigDecimal.ONE);

        assertThat(query.matches(ReceiptFixtures.draft("a", "S", "2024-01-01T00:00:00Z", "1"))).isTrue();
    }
}

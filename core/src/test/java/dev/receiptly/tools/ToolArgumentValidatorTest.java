package dev.receiptly.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.receiptly.receipts.PurchasedItem;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolArgumentValidatorTest {

    private static final String REFERENCE = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void acceptsWellFormedReferenceWithSurroundingWhitespace() {
        assertThat(ToolArgumentValidator.reference(" " + REFERENCE + "\n")).isEqualTo(REFERENCE);
    }

    @Test
    void rejectsMalformedReferences() {
        assertThatThrownBy(() -> ToolArgumentValidator.reference("r1"))
            .isInstanceOf(InvalidArgumentException.class)
            .satisfies(ex -> assertThat(((InvalidArgumentException) ex).getArgument()).isEqualTo("imageReference"));
        assertThatThrownBy(() -> ToolArgumentValidator.reference(REFERENCE.toUpperCase()))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ToolArgumentValidator.reference(null))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void parsesSupportedTimestampFormatsAsUtc() {
        Instant expected = Instant.parse("2024-03-01T10:00:00Z");

        assertThat(ToolArgumentValidator.timestamp("t", "2024-03-01T10:00:00Z", false)).isEqualTo(expected);
        assertThat(ToolArgumentValidator.timestamp("t", "2024-03-01T17:00:00+07:00", false)).isEqualTo(expected);
        assertThat(ToolArgumentValidator.timestamp("t", "2024-03-01T10:00:00", false)).isEqualTo(expected);
    }

    @Test
    void expandsPlainDatesToDayBoundaries() {
        assertThat(ToolArgumentValidator.timestamp("startTime", "2024-01-01", false))
            .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(ToolArgumentValidator.timestamp("endTime", "2024-12-31", true))
            .isEqualTo(Instant.parse("2024-12-31T23:59:59.999999999Z"));
    }

    @Test
    void rejectsMalformedTimestamps() {
        assertThatThrownBy(() -> ToolArgumentValidator.timestamp("transactionTime", "yesterday", false))
            .isInstanceOf(InvalidArgumentException.class)
            .hasMessageContaining("transactionTime");
        assertThatThrownBy(() -> ToolArgumentValidator.timestamp("transactionTime", "2024-13-01T00:00:00Z", false))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ToolArgumentValidator.timestamp("transactionTime", "", false))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void treatsMinusOneAsUnboundedRangeBound() {
        assertThat(ToolArgumentValidator.rangeBound("minAmount", new BigDecimal("-1"))).isNull();
        assertThat(ToolArgumentValidator.rangeBound("minAmount", new BigDecimal("-1.00"))).isNull();
        assertThat(ToolArgumentValidator.rangeBound("minAmount", null)).isNull();
        assertThat(ToolArgumentValidator.rangeBound("minAmount", BigDecimal.ZERO)).isEqualByComparingTo("0");
        assertThatThrownBy(() -> ToolArgumentValidator.rangeBound("minAmount", new BigDecimal("-2")))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void rejectsNegativeOrMissingAmounts() {
        assertThatThrownBy(() -> ToolArgumentValidator.amount("totalAmount", new BigDecimal("-1")))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ToolArgumentValidator.amount("totalAmount", null))
            .isInstanceOf(InvalidArgumentException.class);
        assertThat(ToolArgumentValidator.amount("totalAmount", BigDecimal.ZERO)).isEqualByComparingTo("0");
    }

    @Test
    void normalizesCurrencyCodes() {
        assertThat(ToolArgumentValidator.currency(" idr ")).isEqualTo("IDR");
        assertThatThrownBy(() -> ToolArgumentValidator.currency("Rp")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ToolArgumentValidator.currency(null)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void defaultsAndCapsLimit() {
        assertThat(ToolArgumentValidator.limit(null)).isEqualTo(ToolArgumentValidator.DEFAULT_LIMIT);
        assertThat(ToolArgumentValidator.limit(7)).isEqualTo(7);
        assertThat(ToolArgumentValidator.limit(500)).isEqualTo(ToolArgumentValidator.MAX_LIMIT);
        assertThatThrownBy(() -> ToolArgumentValidator.limit(0)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void rejectsBlankStoreNameAndQuery() {
        assertThatThrownBy(() -> ToolArgumentValidator.storeName(" ")).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ToolArgumentValidator.query("")).isInstanceOf(InvalidArgumentException.class);
        assertThat(ToolArgumentValidator.storeName(" Cafe X ")).isEqualTo("Cafe X");
    }

    @Test
    void validatesPurchasedItems() {
        List<PurchasedItem> items = ToolArgumentValidator.purchasedItems(
            List.of(new PurchasedItemArgument(" Latte ", new BigDecimal("15000"))));

        assertThat(items).containsExactly(new PurchasedItem("Latte", new BigDecimal("15000")));
        assertThat(ToolArgumentValidator.purchasedItems(null)).isEmpty();
        assertThatThrownBy(() -> ToolArgumentValidator.purchasedItems(
            List.of(new PurchasedItemArgument("Latte", new BigDecimal("-5")))))
            .isInstanceOf(InvalidArgumentException.class)
            .hasMessageContaining("purchasedItems[0].price");
        assertThatThrownBy(() -> ToolArgumentValidator.purchasedItems(Arrays.asList((PurchasedItemArgument) null)))
            .isInstanceOf(InvalidArgumentException.class);
    }
}

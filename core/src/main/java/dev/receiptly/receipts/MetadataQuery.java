package dev.receiptly.receipts;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive transaction-time range plus an optional inclusive amount range. A {@code null} amount bound is
 * unbounded on that side.
 */
public record MetadataQuery(Instant start, Instant end, BigDecimal minAmount, BigDecimal maxAmount) {

    public MetadataQuery {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidRangeException("Start time %s is after end time %s".formatted(start, end));
        }
        if (minAmount != null && maxAmount != null && minAmount.compareTo(maxAmount) > 0) {
            throw new InvalidRangeException("Minimum amount %s is greater than maximum amount %s"
                .formatted(minAmount.toPlainString(), maxAmount.toPlainString()));
        }
    }

    public boolean matches(ReceiptRecord record) {
        return matchesTime(record) && matchesAmount(record);
    }

    public boolean matchesTime(ReceiptRecord record) {
        Instant time = record.transactionTime();
        return !time.isBefore(start) && !time.isAfter(end);
    }

    public boolean matchesAmount(ReceiptRecord record) {
        BigDecimal amount = record.totalAmount();
        if (minAmount != null && amount.compareTo(minAmount) < 0) {
            return false;
        }
        return maxAmount == null || amount.compareTo(maxAmount) <= 0;
    }
}

package dev.receiptly.tools;

import dev.receiptly.receipts.PurchasedItem;
import dev.receiptly.storage.ContentReferences;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Turns the loosely typed arguments a model sends into the strict values the receipt store expects.
 * Timestamps without an offset are read as UTC.
 */
public final class ToolArgumentValidator {

    public static final int DEFAULT_LIMIT = 5;
    public static final int MAX_LIMIT = 50;

    private static final BigDecimal UNBOUNDED = BigDecimal.ONE.negate();
    private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

    private ToolArgumentValidator() {
        // Utility class
    }

    public static String reference(String value) {
        String reference = value != null ? value.strip() : null;
        if (!ContentReferences.isValid(reference)) {
            throw new InvalidArgumentException("imageReference",
                "Image reference must be %d lowercase hex characters".formatted(ContentReferences.REFERENCE_LENGTH));
        }
        return reference;
    }

    public static String storeName(String value) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidArgumentException("storeName", "Store name must not be empty");
        }
        return value.strip();
    }

    /**
     * Accepts ISO-8601 instants, offset date-times, local date-times and plain dates. A plain date maps to the
     * start of the day, or to its last nanosecond when {@code endOfDay} is set.
     */
    public static Instant timestamp(String argument, String value, boolean endOfDay) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidArgumentException(argument, argument + " must not be empty");
        }
        String text = value.strip();
        try {
            if (text.indexOf('T') < 0) {
                LocalTime time = endOfDay ? LocalTime.MAX : LocalTime.MIDNIGHT;
                return LocalDate.parse(text).atTime(time).toInstant(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new InvalidArgumentException(argument,
                "%s '%s' is not an ISO-8601 timestamp or date".formatted(argument, text));
        }
    }

    public static BigDecimal amount(String argument, BigDecimal value) {
        if (value == null) {
            throw new InvalidArgumentException(argument, argument + " is required");
        }
        if (value.signum() < 0) {
            throw new InvalidArgumentException(argument,
                "%s must not be negative, was %s".formatted(argument, value.toPlainString()));
        }
        return value;
    }

    /**
     * @return {@code null} for an absent bound or the {@code -1} sentinel
     */
    public static BigDecimal rangeBound(String argument, BigDecimal value) {
        if (value == null || value.compareTo(UNBOUNDED) == 0) {
            return null;
        }
        if (value.signum() < 0) {
            throw new InvalidArgumentException(argument,
                "%s must be -1 (unbounded) or non-negative, was %s".formatted(argument, value.toPlainString()));
        }
        return value;
    }

    public static String currency(String value) {
        String currency = value != null ? value.strip().toUpperCase(Locale.ROOT) : "";
        if (!CURRENCY.matcher(currency).matches()) {
            throw new InvalidArgumentException("currency", "Currency must be a three-letter code, was '%s'"
                .formatted(value));
        }
        return currency;
    }

    public static int limit(Integer value) {
        if (value == null) {
            return DEFAULT_LIMIT;
        }
        if (value <= 0) {
            throw new InvalidArgumentException("limit", "Limit must be positive, was " + value);
        }
        return Math.min(value, MAX_LIMIT);
    }

    public static String query(String value) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidArgumentException("queryText", "Query text must not be empty");
        }
        return value.strip();
    }

    public static List<PurchasedItem> purchasedItems(List<PurchasedItemArgument> items) {
        if (items == null) {
            return List.of();
        }
        List<PurchasedItem> validated = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            PurchasedItemArgument item = items.get(i);
            String argument = "purchasedItems[" + i + "]";
            if (item == null || !StringUtils.hasText(item.name())) {
                throw new InvalidArgumentException(argument, argument + " must have a name");
            }
            validated.add(new PurchasedItem(item.name().strip(), amount(argument + ".price", item.price())));
        }
        return validated;
    }
}

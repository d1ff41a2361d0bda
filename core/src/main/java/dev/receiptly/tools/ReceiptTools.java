package dev.receiptly.tools;

import dev.receiptly.conversation.ConversationContextService;
import dev.receiptly.conversation.ConversationMdc;
import dev.receiptly.conversation.ImageUnavailableException;
import dev.receiptly.conversation.ResolvedImage;
import dev.receiptly.embedding.EmbeddingUnavailableException;
import dev.receiptly.gateway.GatewayTimeoutException;
import dev.receiptly.receipts.DuplicateReceiptException;
import dev.receiptly.receipts.InvalidRangeException;
import dev.receiptly.receipts.MetadataQuery;
import dev.receiptly.receipts.PurchasedItem;
import dev.receiptly.receipts.ReceiptNotFoundException;
import dev.receiptly.receipts.ReceiptRecord;
import dev.receiptly.receipts.ReceiptStoreException;
import dev.receiptly.receipts.ReceiptStoreService;
import dev.receiptly.storage.BlobGateway;
import dev.receiptly.storage.BlobStorageException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Operations the model may call. Every call answers with a {@link ToolResult}; failures are mapped to
 * {@link ToolErrorCode}s and nothing is retried here.
 */
@Component
public class ReceiptTools {

    /** {@link ToolContext} key holding the conversation session id. */
    public static final String SESSION_ID_KEY = "sessionId";

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptTools.class);

    private final ConversationContextService conversation;
    private final ReceiptStoreService receiptStore;
    private final BlobGateway blobGateway;

    public ReceiptTools(ConversationContextService conversation, ReceiptStoreService receiptStore,
        BlobGateway blobGateway) {
        this.conversation = Objects.requireNonNull(conversation, "conversation");
        this.receiptStore = Objects.requireNonNull(receiptStore, "receiptStore");
        this.blobGateway = Objects.requireNonNull(blobGateway, "blobGateway");
    }

    public static ToolContext sessionContext(String sessionId) {
        return new ToolContext(Map.of(SESSION_ID_KEY, sessionId));
    }

    @Tool(name = "store_receipt", description = "Store a receipt extracted from an image uploaded in this"
        + " conversation. Refer to the image by the value of its [IMAGE-ID ...] marker.")
    public ToolResult<ReceiptView> storeReceipt(
        @ToolParam(description = "Reference from the image's [IMAGE-ID ...] marker") String imageReference,
        @ToolParam(description = "Merchant name as printed on the receipt") String storeName,
        @ToolParam(description = "Purchase time as ISO-8601, UTC when no offset is given") String transactionTime,
        @ToolParam(description = "Receipt total, non-negative") BigDecimal totalAmount,
        @ToolParam(description = "Line items in receipt order", required = false)
        List<PurchasedItemArgument> purchasedItems,
        @ToolParam(description = "Three-letter currency code, for example IDR or EUR") String currency,
        ToolContext toolContext) {

        String sessionId = sessionId(toolContext);
        return execute("store_receipt", sessionId, () -> {
            if (!StringUtils.hasText(sessionId)) {
                throw new InvalidArgumentException(SESSION_ID_KEY, "store_receipt needs a conversation session");
            }
            String reference = ToolArgumentValidator.reference(imageReference);
            ConversationMdc.attachReference(reference);
            String name = ToolArgumentValidator.storeName(storeName);
            Instant time = ToolArgumentValidator.timestamp("transactionTime", transactionTime, false);
            BigDecimal total = ToolArgumentValidator.amount("totalAmount", totalAmount);
            List<PurchasedItem> items = ToolArgumentValidator.purchasedItems(purchasedItems);
            String currencyCode = ToolArgumentValidator.currency(currency);

            ResolvedImage image = conversation.resolve(sessionId, reference);
            if (image.source() == ResolvedImage.Source.RECEIPT_STORE) {
                throw new DuplicateReceiptException(reference);
            }

            ConversationMdc.setStage("upload-image");
            String imageUri = blobGateway.put(image.content(), image.mimeType());
            ConversationMdc.setStage("store-receipt");
            ReceiptRecord draft = ReceiptRecord.draft(reference, name, time, total, currencyCode, items, imageUri);
            return ReceiptView.from(receiptStore.store(draft));
        });
    }

    @Tool(name = "search_receipts_by_range", description = "Find receipts whose transaction time lies in an"
        + " inclusive range, optionally restricted to an inclusive total amount range. Use -1 for an open"
        + " amount bound.")
    public ToolResult<List<ReceiptView>> searchReceiptsByRange(
        @ToolParam(description = "Range start, ISO-8601 timestamp or date") String startTime,
        @ToolParam(description = "Range end, ISO-8601 timestamp or date") String endTime,
        @ToolParam(description = "Minimum total, -1 for no minimum", required = false) BigDecimal minAmount,
        @ToolParam(description = "Maximum total, -1 for no maximum", required = false) BigDecimal maxAmount) {

        return execute("search_receipts_by_range", null, () -> {
            MetadataQuery query = new MetadataQuery(
                ToolArgumentValidator.timestamp("startTime", startTime, false),
                ToolArgumentValidator.timestamp("endTime", endTime, true),
                ToolArgumentValidator.rangeBound("minAmount", minAmount),
                ToolArgumentValidator.rangeBound("maxAmount", maxAmount));
            return receiptStore.searchByMetadata(query).stream().map(ReceiptView::from).toList();
        });
    }

    @Tool(name = "search_receipts_by_text", description = "Find the receipts most similar to a free-text"
        + " description, nearest first.")
    public ToolResult<List<ReceiptMatchView>> searchReceiptsByText(
        @ToolParam(description = "What to look for, for example 'coffee in Jakarta'") String queryText,
        @ToolParam(description = "Maximum number of results, default 5, at most 50", required = false)
        Integer limit) {

        return execute("search_receipts_by_text", null, () -> {
            String query = ToolArgumentValidator.query(queryText);
            int effectiveLimit = ToolArgumentValidator.limit(limit);
            return receiptStore.searchBySimilarity(query, effectiveLimit).stream()
                .map(ReceiptMatchView::from)
                .toList();
        });
    }

    @Tool(name = "get_receipt", description = "Fetch a stored receipt by its image reference.")
    public ToolResult<ReceiptView> getReceipt(
        @ToolParam(description = "Reference from the image's [IMAGE-ID ...] marker") String imageReference) {

        return execute("get_receipt", null, () -> {
            String reference = ToolArgumentValidator.reference(imageReference);
            ConversationMdc.attachReference(reference);
            return ReceiptView.from(receiptStore.require(reference));
        });
    }

    private <T> ToolResult<T> execute(String tool, String sessionId, Supplier<T> operation) {
        try (ConversationMdc.Scope ignored = ConversationMdc.open(sessionId)) {
            ConversationMdc.setStage(tool);
            try {
                T data = operation.get();
                LOGGER.info("Tool {} succeeded", tool);
                return ToolResult.success(data);
            } catch (DuplicateReceiptException ex) {
                return rejected(tool, ToolErrorCode.DUPLICATE_RECEIPT,
                    "Receipt %s is already stored".formatted(ex.getReceiptId()));
            } catch (InvalidRangeException ex) {
                return rejected(tool, ToolErrorCode.INVALID_RANGE, ex.getMessage());
            } catch (InvalidArgumentException | IllegalArgumentException ex) {
                return rejected(tool, ToolErrorCode.INVALID_ARGUMENT, ex.getMessage());
            } catch (ReceiptNotFoundException ex) {
                return rejected(tool, ToolErrorCode.NOT_FOUND, ex.getMessage());
            } catch (ImageUnavailableException ex) {
                return rejected(tool, ToolErrorCode.IMAGE_UNAVAILABLE, ex.getMessage());
            } catch (EmbeddingUnavailableException ex) {
                return failed(tool, ToolErrorCode.EMBEDDING_UNAVAILABLE, ex);
            } catch (GatewayTimeoutException ex) {
                return failed(tool, ToolErrorCode.GATEWAY_TIMEOUT, ex);
            } catch (ReceiptStoreException | BlobStorageException ex) {
                return failed(tool, ToolErrorCode.STORAGE_FAILURE, ex);
            }
        }
    }

    private static <T> ToolResult<T> rejected(String tool, ToolErrorCode code, String message) {
        LOGGER.info("Tool {} rejected with {}: {}", tool, code, message);
        return ToolResult.failure(ToolError.of(code, message));
    }

    private static <T> ToolResult<T> failed(String tool, ToolErrorCode code, RuntimeException ex) {
        LOGGER.warn("Tool {} failed with {}", tool, code, ex);
        return ToolResult.failure(ToolError.of(code, ex.getMessage()));
    }

    private static String sessionId(ToolContext toolContext) {
        if (toolContext == null || toolContext.getContext() == null) {
            return null;
        }
        Object value = toolContext.getContext().get(SESSION_ID_KEY);
        return value != null ? value.toString() : null;
    }
}

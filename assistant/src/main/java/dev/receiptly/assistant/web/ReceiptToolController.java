package dev.receiptly.assistant.web;

import dev.receiptly.tools.PurchasedItemArgument;
import dev.receiptly.tools.ReceiptMatchView;
import dev.receiptly.tools.ReceiptTools;
import dev.receiptly.tools.ReceiptView;
import dev.receiptly.tools.ToolResult;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the receipt tools over HTTP. Domain failures are reported inside the {@link ToolResult} envelope
 * with status 200, the same way the model receives them.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReceiptToolController {

    private final ReceiptTools receiptTools;

    public ReceiptToolController(ReceiptTools receiptTools) {
        this.receiptTools = receiptTools;
    }

    @PostMapping(path = "/sessions/{sessionId}/tools/store-receipt", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ToolResult<ReceiptView> storeReceipt(@PathVariable("sessionId") String sessionId,
        @RequestBody StoreReceiptRequest request) {
        return receiptTools.storeReceipt(request.imageReference(), request.storeName(), request.transactionTime(),
            request.totalAmount(), request.purchasedItems(), request.currency(),
            ReceiptTools.sessionContext(sessionId));
    }

    @PostMapping(path = "/tools/search-by-range", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ToolResult<List<ReceiptView>> searchByRange(@RequestBody RangeSearchRequest request) {
        return receiptTools.searchReceiptsByRange(request.startTime(), request.endTime(), request.minAmount(),
            request.maxAmount());
    }

    @PostMapping(path = "/tools/search-by-text", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ToolResult<List<ReceiptMatchView>> searchByText(@RequestBody TextSearchRequest request) {
        return receiptTools.searchReceiptsByText(request.queryText(), request.limit());
    }

    @GetMapping(path = "/tools/receipts/{reference}")
    public ToolResult<ReceiptView> getReceipt(@PathVariable("reference") String reference) {
        return receiptTools.getReceipt(reference);
    }

    public record StoreReceiptRequest(String imageReference, String storeName, String transactionTime,
        BigDecimal totalAmount, List<PurchasedItemArgument> purchasedItems, String currency) { }

    public record RangeSearchRequest(String startTime, String endTime, BigDecimal minAmount,
        BigDecimal maxAmount) { }

    public record TextSearchRequest(String queryText, Integer limit) { }
}

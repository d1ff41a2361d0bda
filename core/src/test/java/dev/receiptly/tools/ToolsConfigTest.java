package dev.receiptly.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import dev.receiptly.conversation.ConversationContextService;
import dev.receiptly.receipts.ReceiptStoreService;
import dev.receiptly.storage.BlobGateway;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;

class ToolsConfigTest {

    @Test
    void publishesAllReceiptTools() {
        ReceiptTools receiptTools = new ReceiptTools(mock(ConversationContextService.class),
            mock(ReceiptStoreService.class), mock(BlobGateway.class));

        ToolCallbackProvider provider = new ToolsConfig().receiptToolCallbacks(receiptTools);

        assertThat(Arrays.stream(provider.getToolCallbacks())
            .map(ToolCallback::getToolDefinition)
            .map(definition -> definition.name()))
            .containsExactlyInAnyOrder("store_receipt", "search_receipts_by_range", "search_receipts_by_text",
                "get_receipt");
    }

    @Test
    void hidesToolContextFromInputSchema() {
        ReceiptTools receiptTools = new ReceiptTools(mock(ConversationContextService.class),
            mock(ReceiptStoreService.class), mock(BlobGateway.class));

        ToolCallback storeReceipt = Arrays.stream(new ToolsConfig().receiptToolCallbacks(receiptTools)
                .getToolCallbacks())
            .filter(callback -> callback.getToolDefinition().name().equals("store_receipt"))
            .findFirst()
            .orElseThrow();

        assertThat(storeReceipt.getToolDefinition().inputSchema())
            .contains("imageReference", "transactionTime", "purchasedItems")
            .doesNotContain("toolContext");
    }
}

package dev.receiptly.tools;

import java.math.BigDecimal;
import org.springframework.ai.tool.annotation.ToolParam;

public record PurchasedItemArgument(
    @ToolParam(description = "Item name as printed on the receipt") String name,
    @ToolParam(description = "Item price, non-negative") BigDecimal price
) {
}

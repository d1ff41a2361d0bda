package dev.receiptly.tools;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolsConfig {

    /**
     * Publishes the {@code @Tool} methods of {@link ReceiptTools} so a chat client can hand them to the model.
     */
    @Bean
    public ToolCallbackProvider receiptToolCallbacks(ReceiptTools receiptTools) {
        return MethodToolCallbackProvider.builder().toolObjects(receiptTools).build();
    }
}

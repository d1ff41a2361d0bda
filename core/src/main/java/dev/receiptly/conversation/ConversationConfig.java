package dev.receiptly.conversation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ConversationProperties.class)
public class ConversationConfig {

    @Bean
    public ContextCompactor contextCompactor(ConversationProperties properties) {
        return new ContextCompactor(properties.getImageRetentionTurns());
    }
}

package dev.receiptly.conversation;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {

    /**
     * Number of most recent image-bearing turns whose payloads stay in the model context.
     */
    private int imageRetentionTurns = ContextCompactor.DEFAULT_RETENTION;

    public int getImageRetentionTurns() {
        return imageRetentionTurns;
    }

    public void setImageRetentionTurns(int imageRetentionTurns) {
        this.imageRetentionTurns = imageRetentionTurns;
    }
}

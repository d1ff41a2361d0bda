package dev.receiptly.conversation;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so every log line written while handling a turn or a tool call carries the session,
 * the image reference being worked on and the current stage.
 */
public final class ConversationMdc {

    static final String KEY_SESSION_ID = "conversation.sessionId";
    static final String KEY_REFERENCE = "conversation.reference";
    static final String KEY_STAGE = "conversation.stage";

    private ConversationMdc() {
    }

    public static Scope open(String sessionId) {
        return new Scope(sessionId);
    }

    public static void attachReference(String reference) {
        putIfHasText(KEY_REFERENCE, reference);
    }

    public static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    /**
     * Restores the MDC that was in place when the scope was opened.
     */
    public static final class Scope implements AutoCloseable {

        private final Map<String, String> previous;

        private Scope(String sessionId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_SESSION_ID, sessionId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}

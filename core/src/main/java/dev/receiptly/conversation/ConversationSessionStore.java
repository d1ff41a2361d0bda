package dev.receiptly.conversation;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Keyed registry of live conversation sessions.
 */
@Component
public class ConversationSessionStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationSessionStore.class);

    private final ConcurrentMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public ConversationSessionStore() {
        this(Clock.systemUTC());
    }

    public ConversationSessionStore(Clock clock) {
        this.clock = clock;
    }

    public ConversationSession getOrCreate(String sessionId) {
        Assert.hasText(sessionId, "Session id must not be empty");
        return sessions.computeIfAbsent(sessionId, id -> {
            LOGGER.info("Opening conversation session {}", id);
            return new ConversationSession(id, clock.instant());
        });
    }

    public Optional<ConversationSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @return {@code true} when a session was removed
     */
    public boolean evict(String sessionId) {
        ConversationSession removed = sessionId != null ? sessions.remove(sessionId) : null;
        if (removed != null) {
            LOGGER.info("Evicted conversation session {} after {} turns", sessionId, removed.turns().size());
        }
        return removed != null;
    }

    public int size() {
        return sessions.size();
    }
}

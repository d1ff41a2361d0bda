package dev.receiptly.conversation;

import dev.receiptly.storage.ContentReferences;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * History of one conversation. Appends are serialized by a per-session lock; readers see an immutable
 * snapshot published through a volatile field.
 */
public final class ConversationSession {

    private final String sessionId;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Snapshot snapshot = new Snapshot(List.of(), Map.of());

    ConversationSession(String sessionId, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.createdAt = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<ConversationTurn> turns() {
        return snapshot.turns();
    }

    public boolean knowsReference(String reference) {
        return snapshot.referenceOrigins().containsKey(reference);
    }

    /**
     * @return the sequence of the turn that first uploaded the reference
     */
    public Optional<Integer> originTurn(String reference) {
        return Optional.ofNullable(snapshot.referenceOrigins().get(reference));
    }

    /**
     * Finds the newest live payload for a reference, whether it is the original upload or a later re-upload.
     */
    public Optional<TurnImage> findLiveImage(String reference) {
        Snapshot current = snapshot;
        Integer origin = current.referenceOrigins().get(reference);
        if (origin == null) {
            return Optional.empty();
        }
        List<ConversationTurn> turns = current.turns();
        for (int i = turns.size() - 1; i >= origin; i--) {
            Optional<TurnImage> live = turns.get(i).findLiveImage(reference);
            if (live.isPresent()) {
                return live;
            }
        }
        return Optional.empty();
    }

    TurnReceipt append(ConversationRole role, String text, List<ImageAttachment> attachments,
        ContextCompactor compactor, Instant now) {

        lock.lock();
        try {
            Snapshot current = snapshot;
            int sequence = current.turns().size();
            Map<String, Integer> origins = new HashMap<>(current.referenceOrigins());
            Set<String> references = new LinkedHashSet<>();
            List<TurnImage> images = new ArrayList<>();
            List<TurnImage> repeated = new ArrayList<>();

            for (ImageAttachment attachment : attachments) {
                String reference = ContentReferences.fromBytes(attachment.content());
                if (!references.add(reference)) {
                    continue;
                }
                TurnImage image = new TurnImage(reference, attachment.mimeType(), attachment.content().clone());
                if (origins.containsKey(reference)) {
                    repeated.add(image);
                } else {
                    origins.put(reference, sequence);
                    images.add(image);
                }
            }

            List<ConversationTurn> appended = new ArrayList<>(current.turns());
            ConversationTurn turn = new ConversationTurn(sequence, role, text, images, repeated, now);
            appended.add(turn);
            List<ConversationTurn> compacted = compactor.compact(appended);

            snapshot = new Snapshot(compacted, origins);
            return new TurnReceipt(sessionId, sequence, new ArrayList<>(references), turn.repeatedReferences(),
                prunedBetween(current.turns(), compacted));
        } finally {
            lock.unlock();
        }
    }

    private static List<String> prunedBetween(List<ConversationTurn> before, List<ConversationTurn> after) {
        List<String> pruned = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            List<TurnImage> previousImages = before.get(i).allImages().toList();
            List<TurnImage> currentImages = after.get(i).allImages().toList();
            for (int j = 0; j < previousImages.size(); j++) {
                if (previousImages.get(j).isLive() && !currentImages.get(j).isLive()) {
                    pruned.add(previousImages.get(j).reference());
                }
            }
        }
        return pruned;
    }

    private record Snapshot(List<ConversationTurn> turns, Map<String, Integer> referenceOrigins) {

        Snapshot {
            turns = List.copyOf(turns);
            referenceOrigins = Map.copyOf(referenceOrigins);
        }
    }
}

package dev.receiptly.conversation;

import dev.receiptly.conversation.RenderedTurn.RenderedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps image payloads only for the newest turns that still carry one and renders the history for the model.
 * Both operations are pure: the input list is never modified.
 */
public class ContextCompactor {

    public static final int DEFAULT_RETENTION = 3;

    private static final String IMAGE_MARKER = "[IMAGE-ID %s]";

    private final int retention;

    public ContextCompactor() {
        this(DEFAULT_RETENTION);
    }

    public ContextCompactor(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("Image retention must be at least one turn, was " + retention);
        }
        this.retention = retention;
    }

    public int retention() {
        return retention;
    }

    public List<ConversationTurn> compact(List<ConversationTurn> turns) {
        return compact(turns, retention);
    }

    /**
     * Walks the history newest to oldest, counting turns with at least one live payload. Turns beyond the first
     * {@code retention} of those lose their payloads; references and MIME types survive.
     */
    public static List<ConversationTurn> compact(List<ConversationTurn> turns, int retention) {
        Objects.requireNonNull(turns, "turns");
        List<ConversationTurn> compacted = new ArrayList<>(turns);
        int liveTurns = 0;
        for (int i = compacted.size() - 1; i >= 0; i--) {
            ConversationTurn turn = compacted.get(i);
            if (!turn.hasLivePayload()) {
                continue;
            }
            liveTurns++;
            if (liveTurns > retention) {
                compacted.set(i, turn.withoutPayloads());
            }
        }
        return List.copyOf(compacted);
    }

    public static List<RenderedTurn> render(List<ConversationTurn> turns) {
        Objects.requireNonNull(turns, "turns");
        return turns.stream().map(ContextCompactor::renderTurn).toList();
    }

    public static String marker(String reference) {
        return IMAGE_MARKER.formatted(reference);
    }

    private static RenderedTurn renderTurn(ConversationTurn turn) {
        StringBuilder text = new StringBuilder(turn.text());
        List<RenderedImage> images = new ArrayList<>();
        turn.allImages().forEach(image -> {
            appendMarker(text, image.reference());
            if (image.isLive()) {
                images.add(new RenderedImage(image.reference(), image.mimeType(), image.payload()));
            }
        });
        return new RenderedTurn(turn.sequence(), turn.role(), text.toString(), images);
    }

    private static void appendMarker(StringBuilder text, String reference) {
        if (!text.isEmpty()) {
            text.append('\n');
        }
        text.append(marker(reference));
    }
}

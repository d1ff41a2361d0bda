package dev.receiptly.conversation;

import java.util.List;

/**
 * Turn as handed to the model: text with one {@code [IMAGE-ID <reference>]} marker per image, plus the payloads
 * that are still inside the retention window.
 */
public record RenderedTurn(int sequence, ConversationRole role, String text, List<RenderedImage> images) {

    public RenderedTurn {
        images = images != null ? List.copyOf(images) : List.of();
    }

    public record RenderedImage(String reference, String mimeType, byte[] payload) {
    }
}

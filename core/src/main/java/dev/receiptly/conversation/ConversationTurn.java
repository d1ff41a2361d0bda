package dev.receiptly.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One entry of a session's history.
 *
 * @param sequence       zero-based position in the session
 * @param role           author of the turn
 * @param text           natural-language content as received
 * @param images         images first uploaded in this turn, in upload order
 * @param repeatedImages re-uploads of images whose original upload happened in an earlier turn; they carry the
 *                       fresh payload but never move the reference's origin
 * @param createdAt      time the turn was recorded
 */
public record ConversationTurn(
    int sequence,
    ConversationRole role,
    String text,
    List<TurnImage> images,
    List<TurnImage> repeatedImages,
    Instant createdAt
) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        text = text != null ? text : "";
        images = images != null ? List.copyOf(images) : List.of();
        repeatedImages = repeatedImages != null ? List.copyOf(repeatedImages) : List.of();
    }

    public List<String> repeatedReferences() {
        return repeatedImages.stream().map(TurnImage::reference).toList();
    }

    public boolean hasLivePayload() {
        return allImages().anyMatch(TurnImage::isLive);
    }

    public Optional<TurnImage> findLiveImage(String reference) {
        return allImages()
            .filter(image -> image.isLive() && image.reference().equals(reference))
            .findFirst();
    }

    Stream<TurnImage> allImages() {
        return Stream.concat(images.stream(), repeatedImages.stream());
    }

    ConversationTurn withoutPayloads() {
        if (!hasLivePayload()) {
            return this;
        }
        return new ConversationTurn(sequence, role, text,
            images.stream().map(TurnImage::withoutPayload).toList(),
            repeatedImages.stream().map(TurnImage::withoutPayload).toList(),
            createdAt);
    }
}

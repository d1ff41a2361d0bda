package dev.receiptly.conversation;

import java.util.List;

/**
 * Outcome of recording a turn.
 *
 * @param sessionId          session the turn was appended to
 * @param sequence           position of the new turn
 * @param imageReferences    references of every image in the turn, in upload order, without duplicates
 * @param repeatedReferences references that were already known to the session before this turn
 * @param prunedReferences   references whose payload left the retention window because of this turn
 */
public record TurnReceipt(
    String sessionId,
    int sequence,
    List<String> imageReferences,
    List<String> repeatedReferences,
    List<String> prunedReferences
) {

    public TurnReceipt {
        imageReferences = List.copyOf(imageReferences);
        repeatedReferences = List.copyOf(repeatedReferences);
        prunedReferences = List.copyOf(prunedReferences);
    }
}

package dev.receiptly.conversation;

import dev.receiptly.receipts.ReceiptRecord;
import dev.receiptly.receipts.ReceiptStoreService;
import dev.receiptly.storage.BlobContent;
import dev.receiptly.storage.BlobGateway;
import dev.receiptly.storage.BlobNotFoundException;
import dev.receiptly.storage.ContentReferences;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Records conversation turns, keeps the image retention window and resolves image references either from the
 * live history or, once pruned, through the receipt store and blob gateway.
 */
@Service
public class ConversationContextService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationContextService.class);

    private final ConversationSessionStore sessionStore;
    private final ContextCompactor compactor;
    private final ReceiptStoreService receiptStore;
    private final BlobGateway blobGateway;
    private final Clock clock;

    @Autowired
    public ConversationContextService(ConversationSessionStore sessionStore, ContextCompactor compactor,
        ReceiptStoreService receiptStore, BlobGateway blobGateway) {
        this(sessionStore, compactor, receiptStore, blobGateway, Clock.systemUTC());
    }

    public ConversationContextService(ConversationSessionStore sessionStore, ContextCompactor compactor,
        ReceiptStoreService receiptStore, BlobGateway blobGateway, Clock clock) {
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
        this.compactor = Objects.requireNonNull(compactor, "compactor");
        this.receiptStore = Objects.requireNonNull(receiptStore, "receiptStore");
        this.blobGateway = Objects.requireNonNull(blobGateway, "blobGateway");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TurnReceipt recordUserTurn(String sessionId, String text, List<ImageAttachment> images) {
        return append(sessionId, ConversationRole.USER, text, images != null ? images : List.of());
    }

    public TurnReceipt recordAssistantTurn(String sessionId, String text) {
        return append(sessionId, ConversationRole.ASSISTANT, text, List.of());
    }

    /**
     * @return the history as the model should see it; empty for an unknown session
     */
    public List<RenderedTurn> render(String sessionId) {
        return sessionStore.find(sessionId)
            .map(session -> ContextCompactor.render(session.turns()))
            .orElse(List.of());
    }

    public List<ConversationTurn> history(String sessionId) {
        return sessionStore.find(sessionId).map(ConversationSession::turns).orElse(List.of());
    }

    /**
     * Produces the bytes behind an image reference. A live payload in the session wins; otherwise the reference
     * is looked up as a receipt id and the image is fetched from the blob gateway.
     *
     * @throws ImageUnavailableException when neither source has the image
     */
    public ResolvedImage resolve(String sessionId, String reference) {
        Assert.hasText(reference, "Image reference must not be empty");
        try (ConversationMdc.Scope ignored = ConversationMdc.open(sessionId)) {
            ConversationMdc.attachReference(reference);
            ConversationMdc.setStage("resolve");

            Optional<ConversationSession> session = sessionStore.find(sessionId);
            Optional<TurnImage> live = session.flatMap(s -> s.findLiveImage(reference));
            if (live.isPresent()) {
                TurnImage image = live.get();
                LOGGER.debug("Resolved image {} from live conversation history", reference);
                return new ResolvedImage(reference, image.mimeType(), image.payload().clone(),
                    ResolvedImage.Source.CONVERSATION);
            }

            boolean knownToSession = session.map(s -> s.knowsReference(reference)).orElse(false);
            Optional<ReceiptRecord> record = ContentReferences.isValid(reference)
                ? receiptStore.getById(reference)
                : Optional.empty();
            if (record.isEmpty() || record.get().imageUri() == null) {
                throw unavailable(reference, knownToSession,
                    "Image %s is neither live in the conversation nor stored with a receipt".formatted(reference),
                    null);
            }

            String imageUri = record.get().imageUri();
            try {
                BlobContent blob = blobGateway.get(imageUri);
                LOGGER.info("Resolved image {} from receipt store ({})", reference, imageUri);
                return new ResolvedImage(reference, blob.contentType(), blob.content(),
                    ResolvedImage.Source.RECEIPT_STORE);
            } catch (BlobNotFoundException ex) {
                throw unavailable(reference, true,
                    "Receipt %s points at missing image %s".formatted(reference, imageUri), ex);
            }
        }
    }

    public boolean evict(String sessionId) {
        return sessionStore.evict(sessionId);
    }

    private TurnReceipt append(String sessionId, ConversationRole role, String text, List<ImageAttachment> images) {
        try (ConversationMdc.Scope ignored = ConversationMdc.open(sessionId)) {
            ConversationMdc.setStage("record-turn");
            ConversationSession session = sessionStore.getOrCreate(sessionId);
            TurnReceipt receipt = session.append(role, text, images, compactor, clock.instant());
            LOGGER.info("Recorded {} turn {} with {} image(s), {} repeated, {} pruned", role, receipt.sequence(),
                receipt.imageReferences().size(), receipt.repeatedReferences().size(),
                receipt.prunedReferences().size());
            if (!receipt.prunedReferences().isEmpty()) {
                LOGGER.debug("Dropped payloads for {}", receipt.prunedReferences());
            }
            return receipt;
        }
    }

    private static ImageUnavailableException unavailable(String reference, boolean dataLoss, String message,
        Throwable cause) {

        if (dataLoss) {
            LOGGER.error("{}; the reference was handed out earlier and can no longer be served", message);
        } else {
            LOGGER.warn(message);
        }
        return new ImageUnavailableException(reference, message, cause);
    }
}

package dev.receiptly.receipts;

import dev.receiptly.embedding.EmbeddingGateway;
import dev.receiptly.embedding.EmbeddingVector;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

/**
 * Receipt store: persists receipts with an embedding of their canonical text and answers metadata and
 * similarity queries. Never retries gateway calls.
 */
@Service
public class ReceiptStoreService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptStoreService.class);

    private static final Comparator<ReceiptRecord> METADATA_ORDER = Comparator
        .comparing(ReceiptRecord::transactionTime)
        .thenComparing(ReceiptRecord::receiptId);

    private final ReceiptRepository repository;
    private final EmbeddingGateway embeddingGateway;
    private final Clock clock;

    @Autowired
    public ReceiptStoreService(ReceiptRepository repository, EmbeddingGateway embeddingGateway) {
        this(repository, embeddingGateway, Clock.systemUTC());
    }

    public ReceiptStoreService(ReceiptRepository repository, EmbeddingGateway embeddingGateway, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.embeddingGateway = Objects.requireNonNull(embeddingGateway, "embeddingGateway");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Embeds and stores a receipt draft.
     *
     * @throws DuplicateReceiptException when a receipt with the same id already exists
     */
    public ReceiptRecord store(ReceiptRecord draft) {
        Objects.requireNonNull(draft, "draft");
        // Skips a billed embedding call for obvious duplicates; the conditional insert below stays authoritative.
        if (repository.exists(draft.receiptId())) {
            LOGGER.info("Receipt {} already stored; rejecting before embedding", draft.receiptId());
            throw new DuplicateReceiptException(draft.receiptId());
        }

        String canonicalText = ReceiptTextRenderer.render(draft);
        EmbeddingVector embedding = embeddingGateway.embed(canonicalText);
        ReceiptRecord record = draft.withEmbedding(embedding, clock.instant());
        ReceiptRecord stored = repository.insert(record);
        LOGGER.info("Stored receipt {} from '{}' ({} {}, {} items)", stored.receiptId(), stored.storeName(),
            stored.totalAmount().toPlainString(), stored.currency(), stored.purchasedItems().size());
        return stored;
    }

    public List<ReceiptRecord> searchByMetadata(MetadataQuery query) {
        Objects.requireNonNull(query, "query");
        List<ReceiptRecord> matches = repository.findByMetadata(query).stream()
            .sorted(METADATA_ORDER)
            .toList();
        LOGGER.info("Metadata search {} .. {} (amount {} .. {}) matched {} receipts", query.start(), query.end(),
            query.minAmount(), query.maxAmount(), matches.size());
        return matches;
    }

    /**
     * @return up to {@code limit} receipts nearest to the embedded query text, nearest first
     */
    public List<ReceiptMatch> searchBySimilarity(String queryText, int limit) {
        Assert.hasText(queryText, "Query text must not be empty");
        Assert.isTrue(limit > 0, "Limit must be positive");
        EmbeddingVector queryVector = embeddingGateway.embed(queryText);
        List<ReceiptMatch> matches = repository.findNearest(queryVector, limit);
        LOGGER.info("Similarity search with query length {} returned {} of at most {} receipts",
            queryText.length(), matches.size(), limit);
        return matches;
    }

    public Optional<ReceiptRecord> getById(String receiptId) {
        Assert.hasText(receiptId, "Receipt id must not be empty");
        return repository.findById(receiptId);
    }

    /**
     * @throws ReceiptNotFoundException when nothing is stored under the id
     */
    public ReceiptRecord require(String receiptId) {
        return getById(receiptId).orElseThrow(() -> new ReceiptNotFoundException(receiptId));
    }
}

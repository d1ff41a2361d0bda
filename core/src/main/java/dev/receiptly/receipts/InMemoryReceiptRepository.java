package dev.receiptly.receipts;

import dev.receiptly.embedding.EmbeddingVector;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local repository used when Firestore is disabled. Similarity search is an exact linear scan.
 */
public class InMemoryReceiptRepository implements ReceiptRepository {

    private final Map<String, StoredReceipt> receipts = new ConcurrentHashMap<>();
    private final AtomicLong insertionSequence = new AtomicLong();

    @Override
    public ReceiptRecord insert(ReceiptRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.embedding() == null) {
            throw new IllegalArgumentException("Receipt " + record.receiptId() + " has no embedding");
        }
        StoredReceipt candidate = new StoredReceipt(record, insertionSequence.incrementAndGet());
        if (receipts.putIfAbsent(record.receiptId(), candidate) != null) {
            throw new DuplicateReceiptException(record.receiptId());
        }
        return record;
    }

    @Override
    public boolean exists(String receiptId) {
        return receipts.containsKey(receiptId);
    }

    @Override
    public Optional<ReceiptRecord> findById(String receiptId) {
        StoredReceipt stored = receipts.get(receiptId);
        return stored != null ? Optional.of(stored.record()) : Optional.empty();
    }

    @Override
    public List<ReceiptRecord> findByMetadata(MetadataQuery query) {
        return receipts.values().stream()
            .sorted(Comparator.comparingLong(StoredReceipt::sequence))
            .map(StoredReceipt::record)
            .filter(query::matches)
            .toList();
    }

    @Override
    public List<ReceiptMatch> findNearest(EmbeddingVector query, int limit) {
        return receipts.values().stream()
            .map(stored -> new RankedReceipt(stored, query.euclideanDistanceTo(stored.record().embedding())))
            .sorted(Comparator.comparingDouble(RankedReceipt::distance)
                .thenComparingLong(ranked -> ranked.stored().sequence()))
            .limit(limit)
            .map(ranked -> new ReceiptMatch(ranked.stored().record(), ranked.distance()))
            .toList();
    }

    int size() {
        return receipts.size();
    }

    private record StoredReceipt(ReceiptRecord record, long sequence) {
    }

    private record RankedReceipt(StoredReceipt stored, double distance) {
    }
}

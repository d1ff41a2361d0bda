package dev.receiptly.receipts;

import dev.receiptly.embedding.EmbeddingVector;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract behind {@link ReceiptStoreService}.
 */
public interface ReceiptRepository {

    /**
     * Inserts the record if, and only if, no record with the same id exists. The existence check and the write are
     * one atomic step: concurrent inserts of the same id yield exactly one success.
     *
     * @throws DuplicateReceiptException when the id is already taken
     */
    ReceiptRecord insert(ReceiptRecord record);

    boolean exists(String receiptId);

    Optional<ReceiptRecord> findById(String receiptId);

    /**
     * @return every record matching the query, in no particular order
     */
    List<ReceiptRecord> findByMetadata(MetadataQuery query);

    /**
     * @return at most {@code limit} records ordered by ascending Euclidean distance to {@code query}, ties in
     * insertion order
     */
    List<ReceiptMatch> findNearest(EmbeddingVector query, int limit);
}

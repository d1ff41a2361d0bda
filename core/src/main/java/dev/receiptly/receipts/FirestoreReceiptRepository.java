package dev.receiptly.receipts;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.VectorQuery;
import com.google.cloud.firestore.VectorQueryOptions;
import com.google.cloud.firestore.VectorQuerySnapshot;
import com.google.cloud.firestore.VectorValue;
import dev.receiptly.embedding.EmbeddingVector;
import dev.receiptly.gateway.GatewayTimeoutException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists receipts in a Firestore collection keyed by receipt id, with the embedding stored as a Firestore
 * vector so similarity search runs as a server-side {@code findNearest} query.
 */
public class FirestoreReceiptRepository implements ReceiptRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreReceiptRepository.class);

    static final String FIELD_STORE_NAME = "storeName";
    static final String FIELD_TRANSACTION_TIME = "transactionTime";
    static final String FIELD_TOTAL_AMOUNT = "totalAmount";
    static final String FIELD_CURRENCY = "currency";
    static final String FIELD_PURCHASED_ITEMS = "purchasedItems";
    static final String FIELD_EMBEDDING = "embedding";
    static final String FIELD_IMAGE_URI = "imageUri";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_DISTANCE = "vectorDistance";

    private final Firestore firestore;
    private final String collectionName;
    private final Duration timeout;

    public FirestoreReceiptRepository(Firestore firestore, String collectionName, Duration timeout) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        LOGGER.info("FirestoreReceiptRepository initialized with collection '{}' and timeout {}", collectionName,
            timeout);
    }

    @Override
    public ReceiptRecord insert(ReceiptRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.embedding() == null || record.createdAt() == null) {
            throw new IllegalArgumentException("Receipt " + record.receiptId() + " must be embedded before insert");
        }
        DocumentReference reference = collection().document(record.receiptId());
        Map<String, Object> payload = toDocument(record);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Creating Firestore document {}/{} with fields {}", collectionName, record.receiptId(),
                payload.keySet());
        }
        try {
            await(reference.create(payload), "create receipt " + record.receiptId());
            LOGGER.info("Firestore document {}/{} created", collectionName, record.receiptId());
            return record;
        } catch (ExecutionException ex) {
            if (isAlreadyExists(ex.getCause())) {
                LOGGER.info("Firestore rejected duplicate receipt {}", record.receiptId());
                throw new DuplicateReceiptException(record.receiptId());
            }
            LOGGER.error("Failed to create Firestore document {}/{}", collectionName, record.receiptId(), ex);
            throw new ReceiptStoreException("Failed to store receipt in Firestore", ex);
        }
    }

    @Override
    public boolean exists(String receiptId) {
        return loadSnapshot(receiptId).exists();
    }

    @Override
    public Optional<ReceiptRecord> findById(String receiptId) {
        DocumentSnapshot snapshot = loadSnapshot(receiptId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(snapshot));
    }

    @Override
    public List<ReceiptRecord> findByMetadata(MetadataQuery query) {
        try {
            QuerySnapshot snapshot = await(collection()
                .whereGreaterThanOrEqualTo(FIELD_TRANSACTION_TIME, toTimestamp(query.start()))
                .whereLessThanOrEqualTo(FIELD_TRANSACTION_TIME, toTimestamp(query.end()))
                .orderBy(FIELD_TRANSACTION_TIME)
                .get(), "load receipts by transaction time");

            List<ReceiptRecord> records = new ArrayList<>();
            for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                ReceiptRecord record = toRecord(document);
                // Firestore filters the time range; amount bounds are applied here to avoid a composite index.
                if (query.matchesAmount(record)) {
                    records.add(record);
                }
            }
            LOGGER.debug("Metadata query {} matched {} of {} documents", query, records.size(), snapshot.size());
            return records;
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to query receipts from Firestore", ex);
            throw new ReceiptStoreException("Failed to query receipts from Firestore", ex);
        }
    }

    @Override
    public List<ReceiptMatch> findNearest(EmbeddingVector query, int limit) {
        VectorQuery vectorQuery = collection().findNearest(FIELD_EMBEDDING, query.toArray(), limit,
            VectorQuery.DistanceMeasure.EUCLIDEAN,
            VectorQueryOptions.newBuilder().setDistanceResultField(FIELD_DISTANCE).build());
        try {
            VectorQuerySnapshot snapshot = await(vectorQuery.get(), "find nearest receipts");
            List<RankedMatch> ranked = new ArrayList<>();
            for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
                ReceiptRecord record = toRecord(document);
                Double distance = document.getDouble(FIELD_DISTANCE);
                double resolvedDistance = distance != null ? distance : query.euclideanDistanceTo(record.embedding());
                ranked.add(new RankedMatch(new ReceiptMatch(record, resolvedDistance), record.createdAt()));
            }
            // Firestore orders by distance only; equal distances fall back to insertion time.
            ranked.sort(Comparator.comparingDouble((RankedMatch match) -> match.match().distance())
                .thenComparing(RankedMatch::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
            return ranked.stream().map(RankedMatch::match).toList();
        } catch (ExecutionException ex) {
            LOGGER.error("Vector search against Firestore collection {} failed", collectionName, ex);
            throw new ReceiptStoreException("Failed to run similarity search in Firestore", ex);
        }
    }

    private DocumentSnapshot loadSnapshot(String receiptId) {
        try {
            return await(collection().document(receiptId).get(), "load receipt " + receiptId);
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to load Firestore document {}/{}", collectionName, receiptId, ex);
            throw new ReceiptStoreException("Failed to load receipt from Firestore", ex);
        }
    }

    private CollectionReference collection() {
        return firestore.collection(collectionName);
    }

    private <T> T await(ApiFuture<T> future, String description) throws ExecutionException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for Firestore to {}", description);
            throw new ReceiptStoreException("Interrupted while waiting for Firestore", ex);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOGGER.warn("Firestore did not {} within {} ms", description, timeout.toMillis());
            throw new GatewayTimeoutException("Firestore", timeout, ex);
        }
    }

    static Map<String, Object> toDocument(ReceiptRecord record) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (PurchasedItem item : record.purchasedItems()) {
            Map<String, Object> itemData = new LinkedHashMap<>();
            itemData.put("name", item.name());
            itemData.put("price", item.price().toPlainString());
            items.add(itemData);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_STORE_NAME, record.storeName());
        payload.put(FIELD_TRANSACTION_TIME, toTimestamp(record.transactionTime()));
        payload.put(FIELD_TOTAL_AMOUNT, record.totalAmount().toPlainString());
        payload.put(FIELD_CURRENCY, record.currency());
        payload.put(FIELD_PURCHASED_ITEMS, items);
        payload.put(FIELD_EMBEDDING, FieldValue.vector(record.embedding().toArray()));
        payload.put(FIELD_IMAGE_URI, record.imageUri());
        payload.put(FIELD_CREATED_AT, toTimestamp(record.createdAt()));
        return payload;
    }

    private ReceiptRecord toRecord(DocumentSnapshot snapshot) {
        VectorValue vector = snapshot.getVectorValue(FIELD_EMBEDDING);
        return new ReceiptRecord(
            snapshot.getId(),
            snapshot.getString(FIELD_STORE_NAME),
            toInstant(snapshot.getTimestamp(FIELD_TRANSACTION_TIME)),
            toDecimal(snapshot.get(FIELD_TOTAL_AMOUNT)),
            snapshot.getString(FIELD_CURRENCY),
            toItems(snapshot.get(FIELD_PURCHASED_ITEMS)),
            vector != null ? EmbeddingVector.of(vector.toArray()) : null,
            snapshot.getString(FIELD_IMAGE_URI),
            toInstant(snapshot.getTimestamp(FIELD_CREATED_AT)));
    }

    private static List<PurchasedItem> toItems(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<PurchasedItem> items = new ArrayList<>();
        for (Object element : list) {
            if (element instanceof Map<?, ?> map && map.get("name") != null) {
                items.add(new PurchasedItem(String.valueOf(map.get("name")), toDecimal(map.get("price"))));
            }
        }
        return items;
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return new BigDecimal(value.toString());
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos()) : null;
    }

    private static boolean isAlreadyExists(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ApiException apiException
                && apiException.getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private record RankedMatch(ReceiptMatch match, Instant createdAt) {
    }
}

package dev.receiptly.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import dev.receiptly.gateway.GatewayTimeoutException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Stores receipt images in Google Cloud Storage under content-addressed object names
 * ({@code <prefix><first four hash chars>/<sha256>}), so uploading the same image twice is a no-op.
 */
public class GcsBlobGateway implements BlobGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsBlobGateway.class);
    private static final String URI_SCHEME = "gs://";
    private static final String CONTENT_HASH_METADATA_KEY = "content-sha256";
    private static final String GATEWAY_NAME = "Google Cloud Storage";
    private static final int HASH_PREFIX_LENGTH = 4;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_PRECONDITION_FAILED = 412;

    private final Storage storage;
    private final GcsProperties properties;

    public GcsBlobGateway(Storage storage, GcsProperties properties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.properties = Objects.requireNonNull(properties, "properties");
        Assert.isTrue(StringUtils.hasText(properties.getBucket()),
            "gcs.bucket must be configured when Google Cloud Storage is enabled");
    }

    @Override
    public String put(byte[] content, String mimeType) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Image content must not be empty");
        }
        String contentHash = ContentReferences.fromBytes(content);
        String objectName = buildObjectName(contentHash);

        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(properties.getBucket(), objectName))
            .setContentType(mimeType)
            .setMetadata(Map.of(CONTENT_HASH_METADATA_KEY, contentHash))
            .build();

        try {
            storage.create(blobInfo, content, Storage.BlobTargetOption.doesNotExist());
            LOGGER.info("Stored receipt image gs://{}/{} ({} bytes)", properties.getBucket(), objectName,
                content.length);
        } catch (StorageException ex) {
            if (ex.getCode() == HTTP_PRECONDITION_FAILED) {
                LOGGER.debug("Receipt image gs://{}/{} already stored", properties.getBucket(), objectName);
            } else if (isTimeout(ex)) {
                throw new GatewayTimeoutException(GATEWAY_NAME, properties.getTimeout(), ex);
            } else {
                throw new BlobStorageException("Failed to upload receipt image '%s'".formatted(objectName), ex);
            }
        }
        return URI_SCHEME + properties.getBucket() + "/" + objectName;
    }

    @Override
    public BlobContent get(String uri) {
        BlobId blobId = parseUri(uri);
        try {
            Blob blob = storage.get(blobId);
            if (blob == null) {
                throw new BlobNotFoundException(uri);
            }
            return new BlobContent(blob.getContent(), blob.getContentType());
        } catch (StorageException ex) {
            if (ex.getCode() == HTTP_NOT_FOUND) {
                throw new BlobNotFoundException(uri);
            }
            if (isTimeout(ex)) {
                throw new GatewayTimeoutException(GATEWAY_NAME, properties.getTimeout(), ex);
            }
            throw new BlobStorageException("Failed to read receipt image '%s'".formatted(uri), ex);
        }
    }

    private String buildObjectName(String contentHash) {
        String prefix = properties.getObjectPrefix() != null ? properties.getObjectPrefix() : "";
        return prefix + contentHash.substring(0, HASH_PREFIX_LENGTH) + "/" + contentHash;
    }

    private BlobId parseUri(String uri) {
        if (!StringUtils.hasText(uri) || !uri.startsWith(URI_SCHEME)) {
            throw new BlobStorageException("Not a Google Cloud Storage URI: " + uri);
        }
        String path = uri.substring(URI_SCHEME.length());
        int separator = path.indexOf('/');
        if (separator <= 0 || separator == path.length() - 1) {
            throw new BlobStorageException("Google Cloud Storage URI is missing bucket or object name: " + uri);
        }
        return BlobId.of(path.substring(0, separator), path.substring(separator + 1));
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

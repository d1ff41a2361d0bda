package dev.receiptly.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.util.StringUtils;

/**
 * Process-local blob gateway used when Google Cloud Storage is disabled. Objects live as long as the process.
 */
public class InMemoryBlobGateway implements BlobGateway {

    static final String URI_PREFIX = "memory://receipt-images/";

    private final Map<String, BlobContent> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] content, String mimeType) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Image content must not be empty");
        }
        String contentHash = ContentReferences.fromBytes(content);
        blobs.putIfAbsent(contentHash, new BlobContent(content.clone(), mimeType));
        return URI_PREFIX + contentHash;
    }

    @Override
    public BlobContent get(String uri) {
        if (!StringUtils.hasText(uri) || !uri.startsWith(URI_PREFIX)) {
            throw new BlobStorageException("Not an in-memory blob URI: " + uri);
        }
        BlobContent stored = blobs.get(uri.substring(URI_PREFIX.length()));
        if (stored == null) {
            throw new BlobNotFoundException(uri);
        }
        return new BlobContent(stored.content().clone(), stored.contentType());
    }
}

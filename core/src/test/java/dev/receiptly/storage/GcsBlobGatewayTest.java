package dev.receiptly.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import dev.receiptly.gateway.GatewayTimeoutException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GcsBlobGatewayTest {

    private static final byte[] CONTENT = "receipt image".getBytes(StandardCharsets.UTF_8);

    private Storage storage;
    private GcsProperties properties;
    private GcsBlobGateway gateway;
    private String contentHash;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        properties = new GcsProperties();
        properties.setBucket("test-bucket");
        gateway = new GcsBlobGateway(storage, properties);
        contentHash = ContentReferences.fromBytes(CONTENT);
    }

    @Test
    void uploadsUnderContentAddressedObjectName() {
        String uri = gateway.put(CONTENT, "image/jpeg");

        ArgumentCaptor<BlobInfo> blobInfoCaptor = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(blobInfoCaptor.capture(), aryEq(CONTENT), any(Storage.BlobTargetOption.class));

        String expectedObject = "receipt-images/" + contentHash.substring(0, 4) + "/" + contentHash;
        BlobInfo blobInfo = blobInfoCaptor.getValue();
        assertThat(blobInfo.getBucket()).isEqualTo("test-bucket");
        assertThat(blobInfo.getName()).isEqualTo(expectedObject);
        assertThat(blobInfo.getContentType()).isEqualTo("image/jpeg");
        assertThat(blobInfo.getMetadata()).containsEntry("content-sha256", contentHash);
        assertThat(uri).isEqualTo("gs://test-bucket/" + expectedObject);
    }

    @Test
    void treatsExistingObjectAsAlreadyStored() {
        when(storage.create(any(BlobInfo.class), any(byte[].class), any(Storage.BlobTargetOption.class)))
            .thenThrow(new StorageException(412, "Precondition Failed"));

        String uri = gateway.put(CONTENT, "image/jpeg");

        assertThat(uri).endsWith("/" + contentHash);
    }

    @Test
    void mapsSocketTimeoutToGatewayTimeout() {
        when(storage.create(any(BlobInfo.class), any(byte[].class), any(Storage.BlobTargetOption.class)))
            .thenThrow(new StorageException(0, "Read timed out", new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.put(CONTENT, "image/jpeg"))
            .isInstanceOf(GatewayTimeoutException.class);
    }

    @Test
    void wrapsOtherUploadFailures() {
        when(storage.create(any(BlobInfo.class), any(byte[].class), any(Storage.BlobTargetOption.class)))
            .thenThrow(new StorageException(500, "Backend Error"));

        assertThatThrownBy(() -> gateway.put(CONTENT, "image/jpeg"))
            .isInstanceOf(BlobStorageException.class)
            .hasMessageContaining(contentHash);
    }

    @Test
    void readsBlobBackWithContentType() {
        Blob blob = mock(Blob.class);
        when(blob.getContent()).thenReturn(CONTENT);
        when(blob.getContentType()).thenReturn("image/jpeg");
        when(storage.get(BlobId.of("test-bucket", "receipt-images/abcd/" + contentHash))).thenReturn(blob);

        BlobContent content = gateway.get("gs://test-bucket/receipt-images/abcd/" + contentHash);

        assertThat(content.content()).isEqualTo(CONTENT);
        assertThat(content.contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void reportsMissingBlob() {
        assertThatThrownBy(() -> gateway.get("gs://test-bucket/receipt-images/none"))
            .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void rejectsMalformedUris() {
        assertThatThrownBy(() -> gateway.get("memory://receipt-images/x"))
            .isInstanceOf(BlobStorageException.class);
        assertThatThrownBy(() -> gateway.get("gs://bucket-only/"))
            .isInstanceOf(BlobStorageException.class);
    }

    @Test
    void requiresBucket() {
        assertThatThrownBy(() -> new GcsBlobGateway(storage, new GcsProperties()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gcs.bucket");
    }
}

package dev.receiptly.storage;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.http.HttpTransportOptions;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Chooses where receipt images live: a GCS bucket when {@code gcs.enabled=true}, otherwise an
 * in-memory gateway.
 */
@Configuration
@EnableConfigurationProperties(GcsProperties.class)
public class GcsConfig {

    private static final Logger log = LoggerFactory.getLogger(GcsConfig.class);

    private final GcsProperties properties;
    private final ResourceLoader resourceLoader;

    public GcsConfig(GcsProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @Bean
    @ConditionalOnProperty(value = "gcs.enabled", havingValue = "true")
    public BlobGateway gcsBlobGateway(Storage storage) {
        log.info("Receipt images are stored in gs://{}/{}", properties.getBucket(), properties.getObjectPrefix());
        return new GcsBlobGateway(storage, properties);
    }

    @Bean
    @ConditionalOnProperty(value = "gcs.enabled", havingValue = "false", matchIfMissing = true)
    public BlobGateway inMemoryBlobGateway() {
        log.warn("gcs.enabled is false; receipt images will not survive a restart");
        return new InMemoryBlobGateway();
    }

    @Bean
    @ConditionalOnProperty(value = "gcs.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Storage receiptImageStorage() throws IOException {
        HttpTransportOptions transport = HttpTransportOptions.newBuilder()
            .setConnectTimeout(properties.timeoutMillis())
            .setReadTimeout(properties.timeoutMillis())
            .build();

        StorageOptions.Builder builder = StorageOptions.newBuilder()
            .setCredentials(loadCredentials())
            .setTransportOptions(transport);
        if (StringUtils.hasText(properties.getProjectId())) {
            builder.setProjectId(properties.getProjectId());
        }
        return builder.build().getService();
    }

    private GoogleCredentials loadCredentials() throws IOException {
        String location = properties.getCredentials();
        if (!StringUtils.hasText(location)) {
            return GoogleCredentials.getApplicationDefault();
        }
        Resource keyFile = resourceLoader.getResource(location);
        if (!keyFile.exists()) {
            log.warn("Service account key {} does not exist, using application default credentials", location);
            return GoogleCredentials.getApplicationDefault();
        }
        try (InputStream in = keyFile.getInputStream()) {
            return GoogleCredentials.fromStream(in);
        }
    }
}

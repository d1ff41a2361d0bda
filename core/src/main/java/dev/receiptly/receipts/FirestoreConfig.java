package dev.receiptly.receipts;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(FirestoreProperties.class)
public class FirestoreConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreConfig.class);

    @Bean
    @ConditionalOnProperty(value = "receipts.firestore.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Firestore firestore(FirestoreProperties properties) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(properties.getProjectId())) {
            optionsBuilder.setProjectId(properties.getProjectId());
        }
        if (StringUtils.hasText(properties.getDatabaseId())) {
            optionsBuilder.setDatabaseId(properties.getDatabaseId());
        }
        if (StringUtils.hasText(properties.getEmulatorHost())) {
            optionsBuilder.setEmulatorHost(properties.getEmulatorHost());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (receipts collection '{}')",
            firestore.getOptions().getProjectId(), properties.getCollection());
        return firestore;
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.firestore.enabled", havingValue = "true")
    public ReceiptRepository firestoreReceiptRepository(Firestore firestore, FirestoreProperties properties) {
        return new FirestoreReceiptRepository(firestore, properties.getCollection(), properties.getTimeout());
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.firestore.enabled", havingValue = "false", matchIfMissing = true)
    public ReceiptRepository inMemoryReceiptRepository() {
        LOGGER.warn("Firestore integration is disabled; receipts are kept in memory only.");
        return new InMemoryReceiptRepository();
    }
}

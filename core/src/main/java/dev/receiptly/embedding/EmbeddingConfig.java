package dev.receiptly.embedding;

import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean
    @ConditionalOnProperty(value = "receipts.embedding.provider", havingValue = EmbeddingProperties.PROVIDER_GOOGLE_AI,
        matchIfMissing = true)
    public EmbeddingGateway googleAiEmbeddingGateway(EmbeddingProperties properties,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getTimeout());
        requestFactory.setReadTimeout(properties.getTimeout());
        RestClient restClient = RestClient.builder()
            .baseUrl(properties.getBaseUrl())
            .requestFactory(requestFactory)
            .build();

        LOGGER.info("Configured Google AI embedding gateway - model: {}, dimensions: {}, timeout: {}",
            properties.getModel(), properties.getDimensions(), properties.getTimeout());
        return new GoogleAiEmbeddingClient(restClient, properties.getApiKey(), properties.getModel(),
            properties.getDimensions(), properties.getTimeout(),
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.embedding.provider", havingValue = EmbeddingProperties.PROVIDER_LOCAL)
    public EmbeddingGateway localEmbeddingGateway(EmbeddingProperties properties) {
        LOGGER.info("Using local hashing embedding gateway with {} dimensions", properties.getDimensions());
        return new LocalHashingEmbeddingGateway(properties.getDimensions());
    }
}

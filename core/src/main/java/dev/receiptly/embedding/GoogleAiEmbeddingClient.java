package dev.receiptly.embedding;

import dev.receiptly.gateway.GatewayTimeoutException;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client that embeds text with Google AI Studio's {@code embedContent} endpoint using an API key.
 */
public class GoogleAiEmbeddingClient implements EmbeddingGateway {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiEmbeddingClient.class);
    private static final String GATEWAY_NAME = "Google AI embedding gateway";

    private final RestClient restClient;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final Duration timeout;
    private final ObservationRegistry observationRegistry;

    public GoogleAiEmbeddingClient(RestClient restClient, String apiKey, String model, int dimensions,
        Duration timeout, ObservationRegistry observationRegistry) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (receipts.embedding.api-key)");
        }
        if (!StringUtils.hasText(model)) {
            throw new IllegalStateException("Embedding model name must be configured");
        }
        if (dimensions <= 0) {
            throw new IllegalStateException("Embedding dimensions must be positive");
        }
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public EmbeddingVector embed(String text) {
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("Text to embed must not be empty");
        }
        Observation observation = Observation.start("receipts.embedding.call", observationRegistry)
            .lowCardinalityKeyValue("model", model);
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI embedding model '{}' with text length {}", model, text.length());
            EmbedContentResponse response = executeRequest(buildRequest(text));
            return extractVector(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private EmbedContentRequest buildRequest(String text) {
        EmbedContentRequest.Content content = new EmbedContentRequest.Content(
            List.of(new EmbedContentRequest.Part(text)));
        return new EmbedContentRequest("models/" + model, content, dimensions);
    }

    private EmbedContentResponse executeRequest(EmbedContentRequest request) {
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:embedContent")
                    .queryParam("key", apiKey)
                    .build(model))
                .body(request)
                .retrieve()
                .body(EmbedContentResponse.class);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                LOGGER.warn("Google AI embedding call timed out after {} ms", timeout.toMillis());
                throw new GatewayTimeoutException(GATEWAY_NAME, timeout, ex);
            }
            throw new EmbeddingUnavailableException("Google AI embedding request could not be sent", ex);
        } catch (RestClientException ex) {
            throw new EmbeddingUnavailableException("Google AI embedding request failed", ex);
        }
    }

    private EmbeddingVector extractVector(EmbedContentResponse response) {
        if (response == null || response.embedding() == null
            || CollectionUtils.isEmpty(response.embedding().values())) {
            throw new EmbeddingUnavailableException("Google AI embedding response did not contain any values");
        }
        List<Double> values = response.embedding().values();
        if (values.size() != dimensions) {
            throw new EmbeddingUnavailableException("Google AI returned a %d-dimensional embedding, expected %d"
                .formatted(values.size(), dimensions));
        }
        return EmbeddingVector.of(values);
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private record EmbedContentRequest(String model, Content content, Integer outputDimensionality) {

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }

    private record EmbedContentResponse(Embedding embedding) {

        private record Embedding(List<Double> values) {
        }
    }
}

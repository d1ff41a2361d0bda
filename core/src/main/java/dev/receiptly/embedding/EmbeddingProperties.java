package dev.receiptly.embedding;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipts.embedding")
public class EmbeddingProperties {

    public static final String PROVIDER_GOOGLE_AI = "google-ai";
    public static final String PROVIDER_LOCAL = "local";

    /**
     * Embedding backend: {@code google-ai} for Google AI Studio or {@code local} for the offline hashing model.
     */
    private String provider = PROVIDER_GOOGLE_AI;

    /**
     * Google AI Studio API key.
     */
    private String apiKey;

    /**
     * Base URL of the Generative Language API.
     */
    private String baseUrl = GoogleAiEmbeddingClient.DEFAULT_BASE_URL;

    /**
     * Embedding model name.
     */
    private String model = "text-embedding-004";

    /**
     * Number of components of every embedding.
     */
    private int dimensions = 768;

    /**
     * Connect and read timeout applied to every embedding call.
     */
    private Duration timeout = Duration.ofSeconds(10);

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}

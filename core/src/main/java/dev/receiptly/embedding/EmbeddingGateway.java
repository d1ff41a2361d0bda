package dev.receiptly.embedding;

/**
 * Turns arbitrary text into a fixed-length dense vector.
 */
public interface EmbeddingGateway {

    /**
     * @return number of components in every vector returned by {@link #embed(String)}
     */
    int dimensions();

    /**
     * Embeds the given text. Implementations never retry; a failed call surfaces as
     * {@link EmbeddingUnavailableException} or {@link dev.receiptly.gateway.GatewayTimeoutException}.
     *
     * @param text non-blank input text
     * @return vector with exactly {@link #dimensions()} components
     */
    EmbeddingVector embed(String text);
}

package dev.receiptly.embedding;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Deterministic offline embedding used by the {@code local} profile: every token is hashed into one
 * component (signed feature hashing) and the result is L2-normalised. Texts sharing tokens end up close
 * to each other, which is enough for local similarity search without calling a model.
 */
public class LocalHashingEmbeddingGateway implements EmbeddingGateway {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    public LocalHashingEmbeddingGateway(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dimensions = dimensions;
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
        double[] values = new double[dimensions];
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            int hash = fnv1a(token);
            int index = Math.floorMod(hash, dimensions);
            values[index] += (hash & 0x80000000) == 0 ? 1.0 : -1.0;
        }
        double norm = 0.0;
        for (double value : values) {
            norm += value * value;
        }
        if (norm > 0.0) {
            norm = Math.sqrt(norm);
            for (int i = 0; i < values.length; i++) {
                values[i] /= norm;
            }
        }
        return EmbeddingVector.of(values);
    }

    private static int fnv1a(String token) {
        int hash = 0x811c9dc5;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= 0x01000193;
        }
        return hash;
    }
}

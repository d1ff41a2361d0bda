package dev.receiptly.embedding;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dense vector produced by the embedding gateway.
 */
public final class EmbeddingVector {

    private final double[] values;

    private EmbeddingVector(double[] values) {
        this.values = values;
    }

    public static EmbeddingVector of(double... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("Embedding vector must have at least one component");
        }
        return new EmbeddingVector(values.clone());
    }

    public static EmbeddingVector of(List<? extends Number> values) {
        Objects.requireNonNull(values, "values");
        double[] copy = new double[values.size()];
        for (int i = 0; i < copy.length; i++) {
            Number value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Embedding component " + i + " is null");
            }
            copy[i] = value.doubleValue();
        }
        return of(copy);
    }

    public int dimensions() {
        return values.length;
    }

    public double[] toArray() {
        return values.clone();
    }

    public double euclideanDistanceTo(EmbeddingVector other) {
        Objects.requireNonNull(other, "other");
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("Cannot compare a %d-dimensional vector with a %d-dimensional one"
                .formatted(values.length, other.values.length));
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double delta = values[i] - other.values[i];
            sum += delta * delta;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmbeddingVector other)) {
            return false;
        }
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[" + values.length + " dimensions]";
    }
}

package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.error.DimensionMismatchException;
import eu.virtualparadox.ragqa.error.ValidationException;

public final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * Cosine similarity {@code dot(a, b) / (|a| * |b|)}, accumulated in double precision.
     *
     * @throws DimensionMismatchException if the vectors differ in length
     * @throws ValidationException        if either vector has zero magnitude
     */
    public static double cosineSimilarity(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            throw new ValidationException("vector", "cosine similarity is undefined for a zero-magnitude vector");
        }
        final double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push |cos| slightly past 1
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * @return {@code true} if every component is zero, i.e. the vector has no direction
     */
    public static boolean isZeroMagnitude(final float[] v) {
        for (final float x : v) {
            if (x != 0.0f) {
                return false;
            }
        }
        return true;
    }
}

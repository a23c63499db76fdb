package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.error.DimensionMismatchException;
import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.retriever.service.VectorMath;

import java.util.List;

/**
 * Dimension checks shared by the index implementations.
 */
final class VectorDimensions {

    private VectorDimensions() {
        // prevent instantiation
    }

    /**
     * Verifies every vector of {@code batch} has the same, positive dimension and that it equals
     * {@code established} when one is known. Zero-magnitude vectors are rejected since no
     * similarity can be computed against them.
     *
     * @param batch       non-empty batch
     * @param established current index dimension, or {@code null}
     * @return the batch dimension
     */
    static int requireConsistent(final List<EmbeddedPassage> batch, final Integer established) {
        final int dim = batch.get(0).dimension();
        if (dim <= 0) {
            throw new ValidationException("vector", "dimension must be > 0");
        }
        if (established != null && established != dim) {
            throw new DimensionMismatchException(established, dim);
        }
        for (final EmbeddedPassage p : batch) {
            if (p.dimension() != dim) {
                throw new DimensionMismatchException(dim, p.dimension());
            }
            if (VectorMath.isZeroMagnitude(p.vectorView())) {
                throw new ValidationException("vector", "passage " + p.id() + " has a zero-magnitude vector");
            }
        }
        return dim;
    }
}

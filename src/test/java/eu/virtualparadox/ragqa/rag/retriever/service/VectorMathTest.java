package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.error.DimensionMismatchException;
import eu.virtualparadox.ragqa.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    @DisplayName("Identical, orthogonal and opposite vectors score 1, 0 and -1")
    void referenceValues() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 2, 3}, new float[]{1, 2, 3})).isCloseTo(1.0, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1})).isCloseTo(0.0, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 1}, new float[]{-1, -1})).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    @DisplayName("Magnitude does not change the score")
    void scaleInvariant() {
        double a = VectorMath.cosineSimilarity(new float[]{1, 2}, new float[]{3, 1});
        double b = VectorMath.cosineSimilarity(new float[]{10, 20}, new float[]{0.3f, 0.1f});
        assertThat(a).isCloseTo(b, within(1e-6));
        assertThat(a).isCloseTo(5 / (Math.sqrt(5) * Math.sqrt(10)), within(1e-6));
    }

    @Test
    @DisplayName("Zero vectors and length mismatches fail instead of returning NaN")
    void undefinedCases() {
        assertThatThrownBy(() -> VectorMath.cosineSimilarity(new float[]{0, 0}, new float[]{1, 0}))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{1, 0, 0}))
                .isInstanceOf(DimensionMismatchException.class);
    }
}

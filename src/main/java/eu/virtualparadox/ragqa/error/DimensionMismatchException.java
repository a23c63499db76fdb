package eu.virtualparadox.ragqa.error;

/**
 * A vector does not have the dimension already established for the index.
 */
public final class DimensionMismatchException extends RagException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(final int expected, final int actual) {
        super(EErrorKind.DIMENSION_MISMATCH,
                "Vector dimension mismatch. Existing=" + expected + ", new=" + actual
                        + " (clear the index if you changed the embedding model)");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}

package eu.virtualparadox.ragqa.error;

/**
 * Failure of a vector index operation.
 */
public final class VectorIndexException extends RagException {

    public VectorIndexException(final String message, final Throwable cause) {
        super(EErrorKind.INDEX, message, cause);
    }
}

package eu.virtualparadox.ragqa.error;

/**
 * Base type of all failures raised by the ingestion and query pipeline.
 */
public abstract class RagException extends RuntimeException {

    private final EErrorKind kind;

    protected RagException(final EErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected RagException(final EErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public EErrorKind getKind() {
        return kind;
    }
}

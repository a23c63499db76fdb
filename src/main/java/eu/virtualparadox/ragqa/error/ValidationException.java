package eu.virtualparadox.ragqa.error;

/**
 * Rejected input. Raised before any collaborator is called and never retried.
 */
public final class ValidationException extends RagException {

    private final String field;

    public ValidationException(final String field, final String message) {
        super(EErrorKind.VALIDATION, field + ": " + message);
        this.field = field;
    }

    /**
     * @return name of the offending input field
     */
    public String getField() {
        return field;
    }
}

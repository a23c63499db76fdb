package eu.virtualparadox.ragqa.error;

/**
 * Failure of the embedding or answer synthesis collaborator, including
 * timeouts and cancellation.
 */
public final class ProviderException extends RagException {

    public ProviderException(final String message) {
        super(EErrorKind.PROVIDER, message);
    }

    public ProviderException(final String message, final Throwable cause) {
        super(EErrorKind.PROVIDER, message, cause);
    }
}

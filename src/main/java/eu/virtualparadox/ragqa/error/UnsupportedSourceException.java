package eu.virtualparadox.ragqa.error;

import java.util.Collection;
import java.util.TreeSet;

public final class UnsupportedSourceException extends RagException {

    public UnsupportedSourceException(final String filename, final Collection<String> supportedExtensions) {
        super(EErrorKind.UNSUPPORTED_SOURCE, "Unsupported file type: " + filename
                + " (supported: " + String.join(", ", new TreeSet<>(supportedExtensions)) + ")");
    }

    public UnsupportedSourceException(final String filename, final Throwable cause) {
        super(EErrorKind.UNSUPPORTED_SOURCE, "Failed to decode " + filename, cause);
    }
}

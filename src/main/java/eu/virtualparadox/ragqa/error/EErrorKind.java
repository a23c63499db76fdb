package eu.virtualparadox.ragqa.error;

/**
 * Classification of pipeline failures, attached to every {@link RagException}
 * so callers and logs can tell which collaborator failed.
 */
public enum EErrorKind {
    VALIDATION,
    DIMENSION_MISMATCH,
    PROVIDER,
    INDEX,
    UNSUPPORTED_SOURCE
}

package eu.virtualparadox.ragqa.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 * Used to reference trimmed sentences.
 */
final class SentenceSpan {
    /**
     * Inclusive start offset into the source text.
     */
    final int start;
    /**
     * Exclusive end offset into the source text.
     */
    final int end;

    SentenceSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }
}

package eu.virtualparadox.ragqa.ingest.model;

import java.util.List;

/**
 * Decoded document ready for chunking.
 *
 * @param text       plain text content, trimmed
 * @param metadata   file level metadata
 * @param pageStarts character offset into {@code text} where each page begins (1st entry is page 1),
 *                   empty when the format has no pages
 */
public record SourceDocument(String text, DocumentMetadata metadata, List<Integer> pageStarts) {

    public SourceDocument {
        pageStarts = pageStarts == null ? List.of() : List.copyOf(pageStarts);
    }

    public static SourceDocument unpaged(final String text, final DocumentMetadata metadata) {
        return new SourceDocument(text, metadata, List.of());
    }

    public String sourceId() {
        return metadata.filename();
    }
}

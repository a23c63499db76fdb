package eu.virtualparadox.ragqa.ingest.model;

/**
 * Immutable span of source text produced by the chunker.
 * <p>{@code startChar}/{@code endChar} are half-open offsets into the source text,
 * so {@code endChar - startChar == content.length()}.</p>
 *
 * @param id        unique passage identifier
 * @param content   passage text, trimmed
 * @param index     zero-based sequence number within its source
 * @param startChar inclusive start offset into the source text
 * @param endChar   exclusive end offset into the source text
 * @param wordCount number of whitespace-separated words in {@code content}
 * @param sourceId  origin identifier (filename or caller supplied), may be {@code null}
 * @param section   optional page/section label, may be {@code null}
 */
public record Passage(String id,
                      String content,
                      int index,
                      int startChar,
                      int endChar,
                      int wordCount,
                      String sourceId,
                      String section) {

    public Passage withSection(final String newSection) {
        return new Passage(id, content, index, startChar, endChar, wordCount, sourceId, newSection);
    }
}

package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.ingest.model.SourceDocument;

import java.util.Set;

/**
 * Format-specific decoder turning raw upload bytes into plain text plus metadata.
 */
public interface TextExtractor {

    /**
     * @return lower-case file extensions (without dot) this extractor handles
     */
    Set<String> extensions();

    /**
     * @param content  raw file bytes
     * @param filename original filename, used as the document's origin identifier
     * @return decoded document
     * @throws eu.virtualparadox.ragqa.error.UnsupportedSourceException if the bytes cannot be decoded
     */
    SourceDocument extract(final byte[] content, final String filename);
}

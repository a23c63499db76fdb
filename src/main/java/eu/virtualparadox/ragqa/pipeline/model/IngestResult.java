package eu.virtualparadox.ragqa.pipeline.model;

import eu.virtualparadox.ragqa.ingest.model.DocumentMetadata;

/**
 * @param sourceId     origin identifier the passages were indexed under
 * @param passageCount number of passages indexed
 * @param metadata     decoded file metadata, {@code null} for plain-text ingestion
 */
public record IngestResult(String sourceId, int passageCount, DocumentMetadata metadata) {

}

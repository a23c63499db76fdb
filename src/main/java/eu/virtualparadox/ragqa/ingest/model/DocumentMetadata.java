package eu.virtualparadox.ragqa.ingest.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Descriptive metadata captured while decoding an uploaded file.
 * Structural fields ({@code pageCount}, {@code title}, ...) are {@code null}
 * for formats that do not carry them.
 */
@Builder
public record DocumentMetadata(String filename,
                               String extension,
                               long sizeBytes,
                               int lines,
                               int words,
                               Instant processedAt,
                               Integer pageCount,
                               String title,
                               String author,
                               String subject,
                               String keywords) {
}

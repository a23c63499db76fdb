package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.ingest.model.DocumentMetadata;
import eu.virtualparadox.ragqa.ingest.model.SourceDocument;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;

/**
 * UTF-8 text and Markdown files. Content is used as is, apart from trimming.
 */
@Service
public final class PlainTextExtractor implements TextExtractor {

    private static final Set<String> EXTENSIONS = Set.of("txt", "md");

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public SourceDocument extract(final byte[] content, final String filename) {
        final String raw = new String(content, StandardCharsets.UTF_8);

        final DocumentMetadata metadata = DocumentMetadata.builder()
                .filename(filename)
                .extension(DocumentStatistics.extension(filename))
                .sizeBytes(content.length)
                .lines(DocumentStatistics.lines(raw))
                .words(DocumentStatistics.words(raw))
                .processedAt(Instant.now())
                .build();

        return SourceDocument.unpaged(raw.trim(), metadata);
    }
}

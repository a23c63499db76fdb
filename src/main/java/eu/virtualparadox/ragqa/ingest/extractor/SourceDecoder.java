package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.error.UnsupportedSourceException;
import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.ingest.model.SourceDocument;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes uploads to the {@link TextExtractor} registered for their file extension.
 */
@Service
public class SourceDecoder {

    private final Map<String, TextExtractor> extractorsByExtension;

    public SourceDecoder(final List<TextExtractor> extractors) {
        final Map<String, TextExtractor> byExtension = new HashMap<>();
        for (final TextExtractor extractor : extractors) {
            for (final String extension : extractor.extensions()) {
                final TextExtractor previous = byExtension.putIfAbsent(extension, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Extension ." + extension + " claimed by "
                            + previous.getClass().getSimpleName() + " and " + extractor.getClass().getSimpleName());
                }
            }
        }
        this.extractorsByExtension = Collections.unmodifiableMap(byExtension);
    }

    /**
     * @param content  raw bytes (non-empty)
     * @param filename original filename (non-blank)
     * @return decoded document
     * @throws ValidationException        if the upload is empty or unnamed
     * @throws UnsupportedSourceException if no extractor handles the extension
     */
    public SourceDocument decode(final byte[] content, final String filename) {
        if (StringUtils.isBlank(filename)) {
            throw new ValidationException("filename", "must not be blank");
        }
        if (content == null || content.length == 0) {
            throw new ValidationException("file", "must not be empty");
        }

        final TextExtractor extractor = extractorsByExtension.get(DocumentStatistics.extension(filename));
        if (extractor == null) {
            throw new UnsupportedSourceException(filename, extractorsByExtension.keySet());
        }
        return extractor.extract(content, filename);
    }
}

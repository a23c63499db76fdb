package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.error.UnsupportedSourceException;
import eu.virtualparadox.ragqa.ingest.cleaner.TextCleaner;
import eu.virtualparadox.ragqa.ingest.model.DocumentMetadata;
import eu.virtualparadox.ragqa.ingest.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * PDF extractor built on Apache PDFBox. Produces:
 * <ul>
 *   <li>a continuous string concatenating the cleaned text of all pages in order, and</li>
 *   <li>the offset at which each page starts in that string.</li>
 * </ul>
 * <p>Sentences continue across page breaks while passages can still be labelled with their pages.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class PdfTextExtractor implements TextExtractor {

    private static final Set<String> EXTENSIONS = Set.of("pdf");

    private final TextCleaner textCleaner;

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public SourceDocument extract(final byte[] content, final String filename) {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder();
            final List<Integer> pageStarts = new ArrayList<>(pageCount);
            final StringBuilder rawText = new StringBuilder();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageRaw = stripper.getText(pdf);
                rawText.append(pageRaw);

                final String pageText = textCleaner.cleanText(pageRaw);
                if (pageText.isEmpty()) {
                    pageStarts.add(text.length());
                    continue;
                }
                if (!text.isEmpty()) {
                    text.append(' ');
                }
                pageStarts.add(text.length());
                text.append(pageText);
            }

            final PDDocumentInformation info = pdf.getDocumentInformation();
            final DocumentMetadata metadata = DocumentMetadata.builder()
                    .filename(filename)
                    .extension(DocumentStatistics.extension(filename))
                    .sizeBytes(content.length)
                    .lines(DocumentStatistics.lines(rawText.toString()))
                    .words(DocumentStatistics.words(rawText.toString()))
                    .processedAt(Instant.now())
                    .pageCount(pageCount)
                    .title(info == null ? null : info.getTitle())
                    .author(info == null ? null : info.getAuthor())
                    .subject(info == null ? null : info.getSubject())
                    .keywords(info == null ? null : info.getKeywords())
                    .build();

            log.info("Extracted {} pages ({} chars) from {}", pageCount, text.length(), filename);
            return new SourceDocument(text.toString(), metadata, pageStarts);
        } catch (final IOException e) {
            throw new UnsupportedSourceException(filename, e);
        }
    }
}

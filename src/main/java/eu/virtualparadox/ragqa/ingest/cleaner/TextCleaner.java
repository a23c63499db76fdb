package eu.virtualparadox.ragqa.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes text pulled out of page-structured documents before chunking.
 * Diacritics are kept; layout artifacts are not.
 */
@Component
public class TextCleaner {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\s]]");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    /**
     * Cleans extracted text:
     * <ul>
     *   <li>NFC normalization</li>
     *   <li>line breaks, zero-width, non-breaking and format characters become a space</li>
     *   <li>soft hyphens and control characters are removed</li>
     *   <li>whitespace runs collapse to one space, ends are trimmed</li>
     * </ul>
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        text = LINE_BREAKS.matcher(text).replaceAll(" ");
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        text = text.replace('\u00A0', ' ');
        // soft hyphen is itself a format char, drop it before the generic rule
        text = text.replace("\u00AD", "");
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUNS.matcher(text).replaceAll(" ").trim();
    }
}

package eu.virtualparadox.ragqa.ingest.extractor;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Counting helpers shared by the extractors.
 */
final class DocumentStatistics {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DocumentStatistics() {
        // prevent instantiation
    }

    static int lines(final String text) {
        return text.split("\n", -1).length;
    }

    static int words(final String text) {
        int count = 0;
        for (final String token : WHITESPACE.split(text)) {
            if (!token.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return lower-case extension without the dot, or an empty string
     */
    static String extension(final String filename) {
        if (filename == null) {
            return "";
        }
        final int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }
}

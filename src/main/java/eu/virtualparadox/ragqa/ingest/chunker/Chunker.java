package eu.virtualparadox.ragqa.ingest.chunker;

import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.ingest.model.Passage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence-based text {@code Chunker} that produces overlapping passages for retrieval.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Sentence splitting:</strong> a sentence ends at a run of {@code .}, {@code !} or {@code ?}
 *       followed by whitespace or the end of the text. Sentences are trimmed. A unit made only of
 *       punctuation is glued to the preceding sentence. No abbreviation handling.</li>
 *   <li><strong>Packing:</strong> sentences are greedily appended to the current passage. When appending
 *       the next sentence would push the passage past {@code chunkSize} characters and the passage is
 *       not empty, the passage is closed.</li>
 *   <li><strong>Overlap:</strong> the next passage starts with the trailing
 *       {@code min(floor(words * 0.3), overlap / 10)} words of the closed one. A result of zero
 *       means no overlap.</li>
 *   <li><strong>Exact offsets:</strong> every passage is an exact substring of the source text, so
 *       {@code startChar}/{@code endChar} are true source positions and start offsets strictly
 *       increase from one passage to the next.</li>
 * </ul>
 *
 * <p>A sentence longer than {@code chunkSize} becomes a passage of its own; it is never dropped
 * and never split.</p>
 *
 * <h2>Thread-safety</h2>
 * Stateless after construction.
 */
@Component
public class Chunker {

    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 50;

    /**
     * Upper bound on the overlap, as a share of the closed passage's word count.
     */
    private static final double MAX_OVERLAP_RATIO = 0.3;

    /**
     * Divides the configured overlap to obtain the overlap word budget.
     */
    private static final int OVERLAP_WORD_DIVISOR = 10;

    /**
     * Terminal punctuation run that closes a sentence.
     */
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+(?=\\s|$)");

    private final int defaultChunkSize;
    private final int defaultOverlap;

    /**
     * @param defaultChunkSize chunk size used when the caller gives none (must be {@code > 0})
     * @param defaultOverlap   overlap used when the caller gives none (must be {@code >= 0})
     */
    public Chunker(@Value("${ragqa.chunker.chunk-size:" + DEFAULT_CHUNK_SIZE + "}") final int defaultChunkSize,
                   @Value("${ragqa.chunker.overlap:" + DEFAULT_OVERLAP + "}") final int defaultOverlap) {
        validateParameters(defaultChunkSize, defaultOverlap);
        this.defaultChunkSize = defaultChunkSize;
        this.defaultOverlap = defaultOverlap;
    }

    public int getDefaultChunkSize() {
        return defaultChunkSize;
    }

    public int getDefaultOverlap() {
        return defaultOverlap;
    }

    /**
     * Chunks with the configured defaults.
     *
     * @param text     input text (non-null, may be blank)
     * @param sourceId origin identifier copied onto every passage, may be {@code null}
     * @return ordered passages, empty for blank input
     */
    public List<Passage> chunk(final String text, final String sourceId) {
        return chunk(text, defaultChunkSize, defaultOverlap, sourceId);
    }

    /**
     * Splits {@code text} into overlapping passages.
     *
     * @param text      input text (non-null, may be blank)
     * @param chunkSize maximum passage length in characters, except for single oversized sentences
     * @param overlap   overlap budget, see class documentation
     * @param sourceId  origin identifier copied onto every passage, may be {@code null}
     * @return ordered passages, empty for blank input
     * @throws ValidationException if {@code text} is null, {@code chunkSize <= 0} or {@code overlap < 0}
     */
    public List<Passage> chunk(final String text,
                               final int chunkSize,
                               final int overlap,
                               final String sourceId) {
        if (text == null) {
            throw new ValidationException("text", "must not be null");
        }
        validateParameters(chunkSize, overlap);

        final List<Passage> result = new ArrayList<>();
        final List<SentenceSpan> sentences = splitSentences(text);
        if (sentences.isEmpty()) {
            return result;
        }

        final String runId = UUID.randomUUID().toString().replace("-", "");

        // current passage is text[bufferStart, bufferEnd)
        int bufferStart = -1;
        int bufferEnd = -1;

        for (final SentenceSpan s : sentences) {
            if (bufferStart < 0) {
                bufferStart = s.start;
                bufferEnd = s.end;
                continue;
            }

            if (s.end - bufferStart > chunkSize) {
                result.add(createPassage(text, bufferStart, bufferEnd, result.size(), runId, sourceId));

                final int overlapStart = overlapStart(text, bufferStart, bufferEnd, overlap);
                bufferStart = overlapStart >= 0 ? overlapStart : s.start;
            }
            bufferEnd = s.end;
        }

        result.add(createPassage(text, bufferStart, bufferEnd, result.size(), runId, sourceId));
        return result;
    }

    private static void validateParameters(final int chunkSize, final int overlap) {
        if (chunkSize <= 0) {
            throw new ValidationException("chunkSize", "must be positive (was " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new ValidationException("overlap", "must not be negative (was " + overlap + ")");
        }
    }

    /**
     * Returns the offset where the overlap suffix of {@code text[start, end)} begins,
     * or {@code -1} when the overlap is empty.
     */
    private static int overlapStart(final String text, final int start, final int end, final int overlap) {
        final int words = countWords(text, start, end);
        final int overlapWords = Math.min((int) Math.floor(words * MAX_OVERLAP_RATIO), overlap / OVERLAP_WORD_DIVISOR);
        if (overlapWords <= 0) {
            return -1;
        }

        int pos = end;
        int seen = 0;
        while (pos > start) {
            while (pos > start && Character.isWhitespace(text.charAt(pos - 1))) {
                pos--;
            }
            while (pos > start && !Character.isWhitespace(text.charAt(pos - 1))) {
                pos--;
            }
            seen++;
            if (seen == overlapWords) {
                return pos;
            }
        }
        return start;
    }

    private static Passage createPassage(final String text,
                                         final int start,
                                         final int end,
                                         final int index,
                                         final String runId,
                                         final String sourceId) {
        final String content = text.substring(start, end);
        final String id = runId + "_" + String.format("%05d", index);
        return new Passage(id, content, index, start, end, countWords(text, start, end), sourceId, null);
    }

    static int countWords(final String text, final int start, final int end) {
        int words = 0;
        boolean inWord = false;
        for (int i = start; i < end; i++) {
            final boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inWord) {
                words++;
            }
            inWord = !whitespace;
        }
        return words;
    }

    /**
     * Splits {@code text} into trimmed sentence spans.
     *
     * @param text source text
     * @return ordered list of non-empty half-open spans
     */
    static List<SentenceSpan> splitSentences(final String text) {
        final List<SentenceSpan> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_END.matcher(text);

        int lastEnd = 0;
        while (matcher.find()) {
            if (addSentence(text, lastEnd, matcher.end(), sentences)) {
                lastEnd = matcher.end();
            }
        }
        if (lastEnd < text.length()) {
            addSentence(text, lastEnd, text.length(), sentences);
        }
        return sentences;
    }

    /**
     * Adds the trimmed span {@code [from, to)}. Punctuation-only spans extend the previous sentence,
     * or, when there is none yet, are left for the next sentence to absorb.
     *
     * @return {@code true} if the span was consumed
     */
    private static boolean addSentence(final String text, final int from, final int to, final List<SentenceSpan> sentences) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start >= end) {
            return true;
        }

        if (isPunctuationOnly(text, start, end)) {
            if (sentences.isEmpty()) {
                return false;
            }
            final SentenceSpan previous = sentences.remove(sentences.size() - 1);
            sentences.add(new SentenceSpan(previous.start, end));
            return true;
        }

        sentences.add(new SentenceSpan(start, end));
        return true;
    }

    private static boolean isPunctuationOnly(final String text, final int start, final int end) {
        for (int i = start; i < end; i++) {
            final char c = text.charAt(i);
            if (c != '.' && c != '!' && c != '?') {
                return false;
            }
        }
        return true;
    }
}

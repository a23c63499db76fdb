package eu.virtualparadox.ragqa.ingest.cleaner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextCleaner}.
 *
 * These tests cover newline handling, control chars, non-breaking spaces,
 * zero-width spaces, soft hyphens, format chars, and whitespace normalization.
 */
class TextCleanerTest {

    private TextCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner = new TextCleaner();
    }

    @Test
    void testNullAndEmptyYieldEmptyString() {
        assertThat(cleaner.cleanText(null)).isEmpty();
        assertThat(cleaner.cleanText("")).isEmpty();
    }

    @Test
    void testSimpleTextIsUnchanged() {
        String input = "Retrieval augments generation.";
        assertThat(cleaner.cleanText(input)).isEqualTo("Retrieval augments generation.");
    }

    @Test
    void testLineBreaksAreReplacedWithSpaces() {
        assertThat(cleaner.cleanText("vector\nindex")).isEqualTo("vector index");
        assertThat(cleaner.cleanText("line1\r\n\r\nline2")).isEqualTo("line1 line2");
    }

    @Test
    void testControlCharactersAreRemovedButTabsSeparate() {
        assertThat(cleaner.cleanText("valid\u0007text")).isEqualTo("validtext");
        assertThat(cleaner.cleanText("col1\tcol2")).isEqualTo("col1 col2");
    }

    @Test
    void testZeroWidthAndNonBreakingSpacesBecomeSpaces() {
        assertThat(cleaner.cleanText("word1\u200Bword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u200Dword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\uFEFFword2")).isEqualTo("word1 word2");
        assertThat(cleaner.cleanText("word1\u00A0word2")).isEqualTo("word1 word2");
    }

    @Test
    void testSoftHyphenIsRemoved() {
        assertThat(cleaner.cleanText("embed\u00ADding")).isEqualTo("embedding");
    }

    @Test
    void testOtherFormatCharactersAreReplaced() {
        // U+202C POP DIRECTIONAL FORMATTING is a common PDF artifact
        assertThat(cleaner.cleanText("word1\u202Cword2")).isEqualTo("word1 word2");
    }

    @Test
    void testDecomposedAccentsAreComposed() {
        assertThat(cleaner.cleanText("cafe\u0301")).isEqualTo("caf\u00E9");
    }

    @Test
    void testCombinedScenario() {
        String input = "   line1\u00A0line2\nline3\u200Bline4   line5\u0008line6\u00ADend  ";
        assertThat(cleaner.cleanText(input)).isEqualTo("line1 line2 line3 line4 line5line6end");
    }
}

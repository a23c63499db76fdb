package eu.virtualparadox.ragqa.ingest.chunker;

import eu.virtualparadox.ragqa.ingest.model.Passage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageSpanResolverTest {

    private final PageSpanResolver resolver = new PageSpanResolver();

    private static Passage passage(int start, int end) {
        return new Passage("run_0000" + start, "x".repeat(end - start), 0, start, end, 1, "doc.pdf", null);
    }

    @Test
    @DisplayName("Passages without page starts are returned unchanged")
    void noPages() {
        List<Passage> passages = List.of(passage(0, 10));
        assertThat(resolver.label(passages, List.of())).isSameAs(passages);
        assertThat(resolver.label(passages, null)).isSameAs(passages);
    }

    @Test
    @DisplayName("Single-page and cross-page passages get p. N and p. N-M labels")
    void labels() {
        // page 1: [0, 100), page 2: [100, 250), page 3: [250, ...)
        List<Integer> pageStarts = List.of(0, 100, 250);
        List<Passage> labelled = resolver.label(List.of(
                passage(0, 90),
                passage(80, 180),
                passage(120, 300),
                passage(260, 270)), pageStarts);

        assertThat(labelled).extracting(Passage::section)
                .containsExactly("p. 1", "p. 1-2", "p. 2-3", "p. 3");
    }

    @Test
    @DisplayName("A passage ending exactly at a page start stays on the previous page")
    void endOffsetIsExclusive() {
        List<Passage> labelled = resolver.label(List.of(passage(10, 100)), List.of(0, 100));
        assertThat(labelled.get(0).section()).isEqualTo("p. 1");
    }

    @Test
    @DisplayName("Empty pages share their start offset and are skipped")
    void emptyPages() {
        // page 2 is empty, so pages 2 and 3 start at the same offset
        List<Integer> pageStarts = List.of(0, 50, 50, 80);
        assertThat(PageSpanResolver.pageOf(pageStarts, 49)).isEqualTo(1);
        assertThat(PageSpanResolver.pageOf(pageStarts, 50)).isEqualTo(3);
        assertThat(PageSpanResolver.pageOf(pageStarts, 200)).isEqualTo(4);
    }
}

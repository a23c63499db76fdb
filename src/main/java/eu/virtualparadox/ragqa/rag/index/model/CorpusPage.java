package eu.virtualparadox.ragqa.rag.index.model;

import java.util.List;

/**
 * One page of a corpus scan.
 *
 * @param passages   passages in insertion order
 * @param nextOffset offset to pass to the next {@code scanAll} call, or {@code -1} when exhausted
 */
public record CorpusPage(List<EmbeddedPassage> passages, int nextOffset) {

    public CorpusPage {
        passages = List.copyOf(passages);
    }

    public boolean hasMore() {
        return nextOffset >= 0;
    }
}

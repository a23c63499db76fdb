package eu.virtualparadox.ragqa.rag.index.model;

import java.util.List;

/**
 * @param totalChunks number of passages in the corpus
 * @param sources     distinct source identifiers, sorted
 */
public record IndexStats(int totalChunks, List<String> sources) {

    public IndexStats {
        sources = List.copyOf(sources);
    }
}

package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.rag.index.model.CorpusPage;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Store of embedded passages, the corpus queried at answer time.
 * <p>
 * Notes:
 * <ul>
 *   <li>All vectors in one index share one dimension. It is established by the first upsert
 *   (or by configuration) and survives {@link #clearAll()}.</li>
 *   <li>Implementations must be safe for concurrent upserts and reads.</li>
 *   <li>Failures of the underlying storage surface as
 *   {@link eu.virtualparadox.ragqa.error.VectorIndexException}.</li>
 * </ul>
 */
public interface VectorIndex {

    /**
     * Adds or replaces passages by id. The whole batch is validated before anything is written.
     *
     * @param passages passages to store (non-null, may be empty)
     * @throws eu.virtualparadox.ragqa.error.DimensionMismatchException if a vector's dimension differs
     *                                                                  from the index dimension or from the rest of the batch
     */
    void upsert(final List<EmbeddedPassage> passages);

    /**
     * Returns one page of the corpus in insertion order.
     *
     * @param offset zero-based position of the first passage to return
     * @return the page and the offset of the next one
     */
    CorpusPage scanAll(final int offset);

    /**
     * @return every passage whose source identifier equals {@code sourceId}, in insertion order
     */
    List<EmbeddedPassage> filterBySource(final String sourceId);

    /**
     * Removes every passage of one source.
     *
     * @return number of passages removed
     */
    int deleteBySource(final String sourceId);

    /**
     * Empties the corpus. The established vector dimension is kept.
     */
    void clearAll();

    IndexStats stats();

    /**
     * @return the vector dimension of this index, empty while not yet established
     */
    OptionalInt dimension();

    /**
     * Pages through {@link #scanAll(int)} until exhausted.
     *
     * @return the complete corpus
     */
    default List<EmbeddedPassage> scanEverything() {
        final List<EmbeddedPassage> all = new ArrayList<>();
        int offset = 0;
        while (offset >= 0) {
            final CorpusPage page = scanAll(offset);
            all.addAll(page.passages());
            offset = page.nextOffset();
        }
        return all;
    }
}

package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.retriever.model.ScoredPassage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.ragqa.support.Passages.embedded;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinearScanRetrieverTest {

    private final LinearScanRetriever retriever = new LinearScanRetriever();

    private final List<EmbeddedPassage> corpus = List.of(
            embedded("far", "doc", 0, 1),
            embedded("near", "doc", 1, 0.1f),
            embedded("mid", "doc", 1, 1),
            embedded("exact", "doc", 1, 0));

    @Test
    @DisplayName("Results are ordered by descending similarity and limited")
    void ranking() {
        List<ScoredPassage> hits = retriever.findSimilar(new float[]{1, 0}, corpus, 3);

        assertThat(hits).extracting(h -> h.passage().id()).containsExactly("exact", "near", "mid");
        assertThat(hits.get(0).score()).isEqualTo(1.0);
        for (int i = 1; i < hits.size(); i++) {
            assertThat(hits.get(i).score()).isLessThanOrEqualTo(hits.get(i - 1).score());
        }
    }

    @Test
    @DisplayName("Equal scores keep corpus order")
    void tiesAreStable() {
        List<EmbeddedPassage> ties = List.of(
                embedded("first", "doc", 1, 0),
                embedded("second", "doc", 2, 0),
                embedded("third", "doc", 3, 0));

        assertThat(retriever.findSimilar(new float[]{1, 0}, ties, 3))
                .extracting(h -> h.passage().id())
                .containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("Limit larger than the corpus returns everything; empty corpus returns nothing")
    void sizes() {
        assertThat(retriever.findSimilar(new float[]{1, 0}, corpus, 10)).hasSize(4);
        assertThat(retriever.findSimilar(new float[]{1, 0}, List.of(), 3)).isEmpty();
    }

    @Test
    @DisplayName("Non-positive limit is rejected")
    void invalidLimit() {
        assertThatThrownBy(() -> retriever.findSimilar(new float[]{1, 0}, corpus, 0))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getField()).isEqualTo("limit"));
    }
}

package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.retriever.model.ScoredPassage;

import java.util.List;

public interface Retriever {

    /**
     * @param query  query vector
     * @param corpus passages to rank
     * @param limit  maximum number of results, must be positive
     * @return at most {@code limit} passages, best first; equal scores keep corpus order
     */
    List<ScoredPassage> findSimilar(final float[] query, final List<EmbeddedPassage> corpus, final int limit);

}

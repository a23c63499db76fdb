package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.retriever.model.ScoredPassage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact nearest-neighbour search: scores every passage of the corpus against the query
 * with {@link VectorMath#cosineSimilarity(float[], float[])} and keeps the best {@code limit}.
 * <p>
 * Cost is linear in the corpus size, which is fine for the corpus sizes this service targets.
 * An approximate index can replace it behind {@link Retriever}.
 */
@Slf4j
@Service
public final class LinearScanRetriever implements Retriever {

    @Override
    public List<ScoredPassage> findSimilar(final float[] query,
                                           final List<EmbeddedPassage> corpus,
                                           final int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit", "must be > 0");
        }
        if (query == null) {
            throw new ValidationException("query", "must not be null");
        }
        if (corpus == null || corpus.isEmpty()) {
            return List.of();
        }

        final List<ScoredPassage> scored = new ArrayList<>(corpus.size());
        for (final EmbeddedPassage p : corpus) {
            scored.add(new ScoredPassage(p, VectorMath.cosineSimilarity(query, p.vectorView())));
        }

        // List.sort is stable, so ties keep corpus order
        scored.sort(Comparator.comparingDouble(ScoredPassage::score).reversed());
        final List<ScoredPassage> top = new ArrayList<>(scored.subList(0, Math.min(limit, scored.size())));

        if (log.isDebugEnabled()) {
            for (final ScoredPassage sp : top) {
                log.debug("Retrieved {} ({}) score={}", sp.passage().id(), sp.passage().sourceId(), sp.score());
            }
        }
        return top;
    }
}

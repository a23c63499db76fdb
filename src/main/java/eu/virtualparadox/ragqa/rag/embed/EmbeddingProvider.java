package eu.virtualparadox.ragqa.rag.embed;

import java.util.List;

/**
 * Computes dense vector embeddings for text.
 * <p>
 * All vectors produced by one provider share one dimension.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single text, e.g. a user question.
     *
     * @param text non-null, non-blank text
     * @return dense vector
     */
    float[] embed(final String text);

    /**
     * Embeds the given texts in batch.
     *
     * @param texts texts to embed
     * @return one vector per text, in input order; same size as {@code texts}
     */
    List<float[]> embedMany(final List<String> texts);
}

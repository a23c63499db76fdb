package eu.virtualparadox.ragqa.rag.embed;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.EmbeddingExecutor;
import eu.virtualparadox.ragqa.error.ProviderException;
import eu.virtualparadox.ragqa.error.RagException;
import eu.virtualparadox.ragqa.rag.retriever.service.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Fans embedding work for one ingestion out over the {@link EmbeddingExecutor}.
 * <p>
 * Texts are cut into batches of {@code ragqa.embedding.batch-size}; each batch is one
 * {@link EmbeddingProvider#embedMany(List)} call on a pool thread. Results are joined in
 * submission order so output order always matches input order. The first failing batch
 * cancels the rest and fails the whole call.
 */
@Slf4j
@Service
public class ParallelEmbedder {

    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingExecutor embeddingExecutor;
    private final int batchSize;

    public ParallelEmbedder(final EmbeddingProvider embeddingProvider,
                            final EmbeddingExecutor embeddingExecutor,
                            final ApplicationConfig config) {
        this.embeddingProvider = embeddingProvider;
        this.embeddingExecutor = embeddingExecutor;
        this.batchSize = Math.max(1, config.getEmbedding().getBatchSize());
    }

    /**
     * @param texts texts to embed
     * @return one vector per text, in input order
     * @throws ProviderException if any batch fails, returns the wrong number of vectors, a missing
     *                           or zero-magnitude vector, or the calling thread is interrupted while waiting
     */
    public List<float[]> embedAll(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        final List<Future<List<float[]>>> futures = new ArrayList<>();
        for (int from = 0; from < texts.size(); from += batchSize) {
            final List<String> batch = List.copyOf(texts.subList(from, Math.min(from + batchSize, texts.size())));
            futures.add(embeddingExecutor.submit(() -> embedBatch(batch)));
        }
        log.debug("Embedding {} texts in {} batches", texts.size(), futures.size());

        final List<float[]> vectors = new ArrayList<>(texts.size());
        try {
            for (final Future<List<float[]>> future : futures) {
                vectors.addAll(future.get());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new ProviderException("Embedding was interrupted", e);
        } catch (final ExecutionException e) {
            cancelAll(futures);
            final Throwable cause = e.getCause();
            if (cause instanceof RagException ragException) {
                throw ragException;
            }
            throw new ProviderException("Embedding failed", cause);
        }
        return vectors;
    }

    private List<float[]> embedBatch(final List<String> batch) {
        final List<float[]> vectors = embeddingProvider.embedMany(batch);
        if (vectors == null || vectors.size() != batch.size()) {
            throw new ProviderException("Embedding provider returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + batch.size() + " texts");
        }
        for (int i = 0; i < vectors.size(); i++) {
            final float[] vector = vectors.get(i);
            if (vector == null || vector.length == 0) {
                throw new ProviderException("Embedding provider returned no vector for text " + i + " of its batch");
            }
            if (VectorMath.isZeroMagnitude(vector)) {
                throw new ProviderException("Embedding provider returned a zero-magnitude vector for text " + i + " of its batch");
            }
        }
        return vectors;
    }

    private static void cancelAll(final List<Future<List<float[]>>> futures) {
        for (final Future<List<float[]>> future : futures) {
            future.cancel(true);
        }
    }
}

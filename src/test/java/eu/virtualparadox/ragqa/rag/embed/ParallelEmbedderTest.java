package eu.virtualparadox.ragqa.rag.embed;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.EmbeddingExecutor;
import eu.virtualparadox.ragqa.error.ProviderException;
import eu.virtualparadox.ragqa.support.HashingEmbeddingProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelEmbedderTest {

    private EmbeddingExecutor executor;
    private ApplicationConfig config;

    @BeforeEach
    void setUp() {
        executor = new EmbeddingExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.setThreadNamePrefix("embed-test-");
        executor.initialize();

        config = new ApplicationConfig();
        config.getEmbedding().setBatchSize(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static List<String> texts(int n) {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            texts.add("text number " + i);
        }
        return texts;
    }

    @Test
    @DisplayName("Vectors come back in input order across batches")
    void preservesOrder() {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(16);
        ParallelEmbedder embedder = new ParallelEmbedder(provider, executor, config);

        List<String> input = texts(10);
        List<float[]> vectors = embedder.embedAll(input);

        assertThat(vectors).hasSize(10);
        for (int i = 0; i < input.size(); i++) {
            assertThat(vectors.get(i)).containsExactly(provider.embed(input.get(i)));
        }
        assertThat(embedder.embedAll(List.of())).isEmpty();
    }

    @Test
    @DisplayName("A failing batch fails the whole call with the provider error")
    void failure() {
        HashingEmbeddingProvider provider = new HashingEmbeddingProvider(16).failingOn("number 7");
        ParallelEmbedder embedder = new ParallelEmbedder(provider, executor, config);

        assertThatThrownBy(() -> embedder.embedAll(texts(10)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("unavailable");
    }

    @Test
    @DisplayName("A provider returning the wrong number of vectors is a provider error")
    void wrongCount() {
        EmbeddingProvider shortChanging = new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                return new float[]{1, 0};
            }

            @Override
            public List<float[]> embedMany(List<String> texts) {
                return List.of(new float[]{1, 0});
            }
        };
        ParallelEmbedder embedder = new ParallelEmbedder(shortChanging, executor, config);

        assertThatThrownBy(() -> embedder.embedAll(texts(2)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("returned 1 vectors for 2 texts");
    }

    @Test
    @DisplayName("Missing or zero-magnitude vectors are provider errors")
    void unusableVectors() {
        EmbeddingProvider withHole = new HashingEmbeddingProvider(4) {
            @Override
            public List<float[]> embedMany(List<String> texts) {
                List<float[]> vectors = new ArrayList<>(super.embedMany(texts));
                vectors.set(vectors.size() - 1, null);
                return vectors;
            }
        };
        assertThatThrownBy(() -> new ParallelEmbedder(withHole, executor, config).embedAll(texts(2)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("no vector");

        EmbeddingProvider flat = new HashingEmbeddingProvider(4) {
            @Override
            public List<float[]> embedMany(List<String> texts) {
                List<float[]> vectors = new ArrayList<>(super.embedMany(texts));
                vectors.set(0, new float[4]);
                return vectors;
            }
        };
        assertThatThrownBy(() -> new ParallelEmbedder(flat, executor, config).embedAll(texts(2)))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("zero-magnitude");
    }

    @Test
    @DisplayName("Interruption while waiting is reported as a provider failure")
    void interrupted() {
        CountDownLatch release = new CountDownLatch(1);
        EmbeddingProvider blocking = new HashingEmbeddingProvider(4) {
            @Override
            public List<float[]> embedMany(List<String> texts) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.embedMany(texts);
            }
        };
        ParallelEmbedder embedder = new ParallelEmbedder(blocking, executor, config);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> embedder.embedAll(texts(4)))
                    .isInstanceOf(ProviderException.class)
                    .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
            release.countDown();
        }
    }
}

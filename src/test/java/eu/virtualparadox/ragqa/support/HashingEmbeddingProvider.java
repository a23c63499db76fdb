package eu.virtualparadox.ragqa.support;

import eu.virtualparadox.ragqa.error.ProviderException;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedder for tests: every lower-cased word is hashed into one of
 * {@code dimension - 1} buckets, the last component is a constant bias so no vector is zero.
 * Texts sharing words therefore score higher than unrelated ones.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile String failOn;
    private volatile String zeroOn;

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    /**
     * Makes every text containing {@code marker} fail with a {@link ProviderException}.
     */
    public HashingEmbeddingProvider failingOn(String marker) {
        this.failOn = marker;
        return this;
    }

    /**
     * Makes every text containing {@code marker} embed to the zero vector.
     */
    public HashingEmbeddingProvider zeroOn(String marker) {
        this.zeroOn = marker;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        if (failOn != null && text.contains(failOn)) {
            throw new ProviderException("embedding backend unavailable");
        }
        if (zeroOn != null && text.contains(zeroOn)) {
            return new float[dimension];
        }

        float[] v = new float[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                v[Math.floorMod(token.hashCode(), dimension - 1)] += 1f;
            }
        }
        v[dimension - 1] = 0.5f;

        double norm = 0;
        for (float x : v) norm += x * x;
        norm = Math.sqrt(norm);
        for (int i = 0; i < v.length; i++) v[i] = (float) (v[i] / norm);
        return v;
    }

    @Override
    public List<float[]> embedMany(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String t : texts) {
            out.add(embed(t));
        }
        return out;
    }
}

package eu.virtualparadox.ragqa.rag.index.model;

import eu.virtualparadox.ragqa.ingest.model.Passage;

import java.util.Arrays;
import java.util.Objects;

/**
 * A {@link Passage} together with its embedding vector. The vector is copied on the way in
 * and on the way out so an indexed entry can never change.
 */
public final class EmbeddedPassage {

    private final Passage passage;
    private final float[] vector;

    public EmbeddedPassage(final Passage passage, final float[] vector) {
        this.passage = Objects.requireNonNull(passage, "passage must not be null");
        Objects.requireNonNull(vector, "vector must not be null");
        this.vector = vector.clone();
    }

    public Passage passage() {
        return passage;
    }

    public String id() {
        return passage.id();
    }

    public String content() {
        return passage.content();
    }

    public String sourceId() {
        return passage.sourceId();
    }

    public int dimension() {
        return vector.length;
    }

    public float[] vector() {
        return vector.clone();
    }

    /**
     * Read-only access for similarity computation without copying. Callers must not modify the array.
     */
    public float[] vectorView() {
        return vector;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final EmbeddedPassage that = (EmbeddedPassage) o;
        return passage.equals(that.passage) && Arrays.equals(vector, that.vector);
    }

    @Override
    public int hashCode() {
        return 31 * passage.hashCode() + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "EmbeddedPassage{id=" + passage.id() + ", source=" + passage.sourceId() + ", dim=" + vector.length + "}";
    }
}

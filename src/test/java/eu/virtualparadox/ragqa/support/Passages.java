package eu.virtualparadox.ragqa.support;

import eu.virtualparadox.ragqa.ingest.model.Passage;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;

/**
 * Fixture builders.
 */
public final class Passages {

    private Passages() {
    }

    public static Passage passage(String id, String sourceId, String content) {
        return new Passage(id, content, 0, 0, content.length(), content.split("\\s+").length, sourceId, null);
    }

    public static EmbeddedPassage embedded(String id, String sourceId, float... vector) {
        return new EmbeddedPassage(passage(id, sourceId, "content of " + id), vector);
    }
}

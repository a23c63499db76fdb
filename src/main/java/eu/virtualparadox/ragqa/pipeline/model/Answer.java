package eu.virtualparadox.ragqa.pipeline.model;

import java.util.List;

/**
 * @param answer  synthesized text, {@code null} when the synthesizer produced none
 * @param sources one attribution per retrieved passage, in retrieval order
 */
public record Answer(String answer, List<SourceAttribution> sources) {

    public Answer {
        sources = List.copyOf(sources);
    }
}

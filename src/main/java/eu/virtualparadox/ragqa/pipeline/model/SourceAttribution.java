package eu.virtualparadox.ragqa.pipeline.model;

/**
 * @param sourceId   origin identifier of the passage
 * @param excerpt    first characters of the passage content
 * @param similarity cosine similarity that ranked the passage
 * @param section    page label such as {@code p. 3}, or {@code null}
 */
public record SourceAttribution(String sourceId, String excerpt, double similarity, String section) {

}

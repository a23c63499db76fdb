package eu.virtualparadox.ragqa.api.dto;

/**
 * {@code chunkSize} and {@code overlap} fall back to the configured defaults when absent.
 */
public record ChunkRequest(String text, Integer chunkSize, Integer overlap, String sourceId) {
}

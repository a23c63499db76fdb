package eu.virtualparadox.ragqa.api.dto;

public record IngestRequest(String text, String sourceId) {
}

package eu.virtualparadox.ragqa.api.dto;

public record DeleteSourceResponse(String sourceId, int removed) {
}

package eu.virtualparadox.ragqa.api.dto;

public record HealthResponse(String status, String service) {
}

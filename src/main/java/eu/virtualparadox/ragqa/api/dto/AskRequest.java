package eu.virtualparadox.ragqa.api.dto;

public record AskRequest(String question) {
}

package eu.virtualparadox.ragqa.api.dto;

import eu.virtualparadox.ragqa.pipeline.model.SourceAttribution;

import java.util.List;

public record AskResponse(String question, String answer, List<SourceAttribution> sources) {
}

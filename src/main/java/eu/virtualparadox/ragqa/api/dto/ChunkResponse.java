package eu.virtualparadox.ragqa.api.dto;

import eu.virtualparadox.ragqa.ingest.model.Passage;
import eu.virtualparadox.ragqa.pipeline.model.ChunkResult;

import java.time.Instant;
import java.util.List;

public record ChunkResponse(List<Passage> passages, Metadata metadata) {

    public record Metadata(int totalChunks, int originalLength, int chunkSize, int overlap, Instant processedAt) {
    }

    public static ChunkResponse from(final ChunkResult result) {
        return new ChunkResponse(result.passages(), new Metadata(
                result.totalChunks(),
                result.originalLength(),
                result.chunkSize(),
                result.overlap(),
                result.processedAt()));
    }
}

package eu.virtualparadox.ragqa.pipeline.model;

import eu.virtualparadox.ragqa.ingest.model.Passage;

import java.time.Instant;
import java.util.List;

public record ChunkResult(List<Passage> passages,
                          int originalLength,
                          int chunkSize,
                          int overlap,
                          Instant processedAt) {

    public ChunkResult {
        passages = List.copyOf(passages);
    }

    public int totalChunks() {
        return passages.size();
    }
}

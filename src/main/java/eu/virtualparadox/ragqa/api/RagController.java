package eu.virtualparadox.ragqa.api;

import eu.virtualparadox.ragqa.api.dto.AskRequest;
import eu.virtualparadox.ragqa.api.dto.AskResponse;
import eu.virtualparadox.ragqa.api.dto.ChunkRequest;
import eu.virtualparadox.ragqa.api.dto.ChunkResponse;
import eu.virtualparadox.ragqa.api.dto.DeleteSourceResponse;
import eu.virtualparadox.ragqa.api.dto.HealthResponse;
import eu.virtualparadox.ragqa.api.dto.IngestRequest;
import eu.virtualparadox.ragqa.pipeline.RagOrchestrator;
import eu.virtualparadox.ragqa.pipeline.model.Answer;
import eu.virtualparadox.ragqa.pipeline.model.IngestResult;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * JSON endpoints over {@link RagOrchestrator}:
 * <pre>
 *   POST   /api/ingest                 index plain text under a source id
 *   POST   /api/upload                 decode and index a .txt, .md or .pdf file
 *   POST   /api/chunk                  chunk text without indexing
 *   POST   /api/ask                    answer a question from the index
 *   GET    /api/stats                  passage count and indexed sources
 *   DELETE /api/index                  drop every passage
 *   DELETE /api/index/sources/{id}     drop the passages of one source
 *   GET    /api/health                 liveness
 * </pre>
 * Failures are rendered by {@link ApiExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RagController {

    static final String SERVICE_NAME = "rag-qa";

    private final RagOrchestrator orchestrator;

    @PostMapping("/ingest")
    public IngestResult ingest(@RequestBody final IngestRequest request) {
        return orchestrator.ingest(request.text(), request.sourceId());
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public IngestResult upload(@RequestParam("file") final MultipartFile file) throws IOException {
        log.info("Upload received: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        return orchestrator.ingestDocument(file.getBytes(), file.getOriginalFilename());
    }

    @PostMapping("/chunk")
    public ChunkResponse chunk(@RequestBody final ChunkRequest request) {
        return ChunkResponse.from(orchestrator.chunk(
                request.text(), request.chunkSize(), request.overlap(), request.sourceId()));
    }

    @PostMapping("/ask")
    public AskResponse ask(@RequestBody final AskRequest request) {
        final Answer answer = orchestrator.answer(request.question());
        return new AskResponse(request.question(), answer.answer(), answer.sources());
    }

    @GetMapping("/stats")
    public IndexStats stats() {
        return orchestrator.stats();
    }

    @DeleteMapping("/index")
    public ResponseEntity<Void> clear() {
        orchestrator.clearAll();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/index/sources/{sourceId}")
    public DeleteSourceResponse deleteSource(@PathVariable("sourceId") final String sourceId) {
        return new DeleteSourceResponse(sourceId, orchestrator.deleteSource(sourceId));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok", SERVICE_NAME);
    }
}

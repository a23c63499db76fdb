package eu.virtualparadox.ragqa.pipeline;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.error.DimensionMismatchException;
import eu.virtualparadox.ragqa.error.ProviderException;
import eu.virtualparadox.ragqa.error.RagException;
import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.ingest.chunker.Chunker;
import eu.virtualparadox.ragqa.ingest.chunker.PageSpanResolver;
import eu.virtualparadox.ragqa.ingest.extractor.SourceDecoder;
import eu.virtualparadox.ragqa.ingest.model.DocumentMetadata;
import eu.virtualparadox.ragqa.ingest.model.Passage;
import eu.virtualparadox.ragqa.ingest.model.SourceDocument;
import eu.virtualparadox.ragqa.pipeline.model.Answer;
import eu.virtualparadox.ragqa.pipeline.model.ChunkResult;
import eu.virtualparadox.ragqa.pipeline.model.IngestResult;
import eu.virtualparadox.ragqa.pipeline.model.SourceAttribution;
import eu.virtualparadox.ragqa.pipeline.request.ERequestKind;
import eu.virtualparadox.ragqa.pipeline.request.RagRequest;
import eu.virtualparadox.ragqa.pipeline.request.RequestRegistry;
import eu.virtualparadox.ragqa.rag.answer.AnswerSynthesizer;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingProvider;
import eu.virtualparadox.ragqa.rag.embed.ParallelEmbedder;
import eu.virtualparadox.ragqa.rag.index.VectorIndex;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import eu.virtualparadox.ragqa.rag.retriever.model.ScoredPassage;
import eu.virtualparadox.ragqa.rag.retriever.service.Retriever;
import eu.virtualparadox.ragqa.rag.retriever.service.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static eu.virtualparadox.ragqa.pipeline.request.ERequestState.*;

/**
 * Runs the two pipelines of the service.
 * <ul>
 *   <li>Ingestion: chunk, embed every passage, then upsert the whole batch. Nothing is written
 *   unless every passage was embedded.</li>
 *   <li>Query: embed the question, rank the whole corpus, synthesize an answer from the top
 *   passages and attribute it to them.</li>
 * </ul>
 * Every call is tracked in the {@link RequestRegistry}. {@link #clearAll()} and
 * {@link #deleteSource(String)} hold the write side of a read/write lock that ingestions and
 * corpus scans share, so an administrative mutation never interleaves with a half-finished
 * upsert or a paged read of the corpus.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RagOrchestrator {

    public static final String NO_DOCUMENTS_ANSWER =
            "No documents have been indexed yet. Please upload a document before asking questions.";

    static final int EXCERPT_LENGTH = 100;
    static final String CONTEXT_SEPARATOR = "\n\n";

    private final Chunker chunker;
    private final PageSpanResolver pageSpanResolver;
    private final SourceDecoder sourceDecoder;
    private final EmbeddingProvider embeddingProvider;
    private final ParallelEmbedder parallelEmbedder;
    private final VectorIndex vectorIndex;
    private final Retriever retriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final RequestRegistry registry;
    private final ApplicationConfig config;

    private final ReentrantReadWriteLock adminLock = new ReentrantReadWriteLock();

    /**
     * Indexes already decoded text under {@code sourceId}.
     *
     * @throws ValidationException if the text is blank or too long, or the source id is blank
     */
    public IngestResult ingest(final String text, final String sourceId) {
        validateText(text);
        requireNonBlank(sourceId, "sourceId");

        final RagRequest request = registry.create(ERequestKind.INGEST, sourceId);
        return runIngestion(request, text, sourceId, List.of(), null);
    }

    /**
     * Decodes an uploaded file and indexes its text under the filename. Passages of paged
     * documents are labelled with their page span.
     *
     * @throws eu.virtualparadox.ragqa.error.UnsupportedSourceException if the file type is unknown or unreadable
     */
    public IngestResult ingestDocument(final byte[] content, final String filename) {
        requireNonBlank(filename, "filename");
        if (content == null || content.length == 0) {
            throw new ValidationException("file", "must not be empty");
        }

        final RagRequest request = registry.create(ERequestKind.INGEST, filename);
        final SourceDocument document;
        try {
            document = sourceDecoder.decode(content, filename);
            if (document.text().isBlank()) {
                throw new ValidationException("file", "contains no extractable text");
            }
            validateText(document.text());
        } catch (final RuntimeException e) {
            fail(request, e);
            throw e;
        }

        log.info("Decoded {} ({} bytes, {} words)", filename, content.length, document.metadata().words());
        return runIngestion(request, document.text(), document.sourceId(), document.pageStarts(), document.metadata());
    }

    /**
     * Chunks without indexing.
     *
     * @param chunkSize maximum passage length, configured default when {@code null}
     * @param overlap   overlap budget, configured default when {@code null}
     */
    public ChunkResult chunk(final String text,
                             final Integer chunkSize,
                             final Integer overlap,
                             final String sourceId) {
        validateText(text);
        final int size = chunkSize != null ? chunkSize : chunker.getDefaultChunkSize();
        final int over = overlap != null ? overlap : chunker.getDefaultOverlap();

        final List<Passage> passages = chunker.chunk(text, size, over, sourceId);
        return new ChunkResult(passages, text.length(), size, over, Instant.now());
    }

    /**
     * Answers {@code question} from the indexed corpus. An empty corpus yields
     * {@link #NO_DOCUMENTS_ANSWER} without sources.
     *
     * @throws ValidationException if the question is blank or too long
     */
    public Answer answer(final String question) {
        requireNonBlank(question, "question");
        if (question.length() > config.getLimits().getMaxQuestionChars()) {
            throw new ValidationException("question",
                    "must be at most " + config.getLimits().getMaxQuestionChars() + " characters");
        }

        final String q = question.trim();
        final RagRequest request = registry.create(ERequestKind.QUERY, q);
        try {
            final List<EmbeddedPassage> corpus = snapshotCorpus();
            if (corpus.isEmpty()) {
                registry.advance(request, ANSWERED);
                log.info("Request {}: corpus is empty, returning the no-documents answer", request.getId());
                return new Answer(NO_DOCUMENTS_ANSWER, List.of());
            }

            final float[] queryVector = embedQuestion(q);
            registry.advance(request, EMBEDDED_QUERY);

            final List<ScoredPassage> hits = retriever.findSimilar(queryVector, corpus, config.getRetrieval().getTopK());
            registry.advance(request, RETRIEVED);

            final String answer = synthesize(q, buildContext(hits));
            registry.advance(request, SYNTHESIZED);

            final List<SourceAttribution> sources = new ArrayList<>(hits.size());
            for (final ScoredPassage hit : hits) {
                final Passage p = hit.passage().passage();
                sources.add(new SourceAttribution(p.sourceId(), excerpt(p.content()), hit.score(), p.section()));
            }
            registry.advance(request, ANSWERED);
            log.info("Request {}: answered from {} of {} passages", request.getId(), hits.size(), corpus.size());
            return new Answer(answer, sources);
        } catch (final RuntimeException e) {
            fail(request, e);
            throw e;
        }
    }

    public IndexStats stats() {
        return vectorIndex.stats();
    }

    public void clearAll() {
        adminLock.writeLock().lock();
        try {
            vectorIndex.clearAll();
        } finally {
            adminLock.writeLock().unlock();
        }
        log.info("Index cleared");
    }

    /**
     * @return number of passages removed
     */
    public int deleteSource(final String sourceId) {
        requireNonBlank(sourceId, "sourceId");

        final int removed;
        adminLock.writeLock().lock();
        try {
            removed = vectorIndex.deleteBySource(sourceId);
        } finally {
            adminLock.writeLock().unlock();
        }
        log.info("Removed {} passages of {}", removed, sourceId);
        return removed;
    }

    private IngestResult runIngestion(final RagRequest request,
                                      final String text,
                                      final String sourceId,
                                      final List<Integer> pageStarts,
                                      final DocumentMetadata metadata) {
        adminLock.readLock().lock();
        try {
            final List<Passage> passages = pageSpanResolver.label(chunker.chunk(text, sourceId), pageStarts);
            registry.advance(request, CHUNKED);

            final List<String> contents = new ArrayList<>(passages.size());
            for (final Passage p : passages) {
                contents.add(p.content());
            }
            final List<float[]> vectors = parallelEmbedder.embedAll(contents);
            registry.advance(request, EMBEDDED);

            final List<EmbeddedPassage> batch = new ArrayList<>(passages.size());
            for (int i = 0; i < passages.size(); i++) {
                batch.add(new EmbeddedPassage(passages.get(i), vectors.get(i)));
            }
            vectorIndex.upsert(batch);
            registry.advance(request, INDEXED);

            log.info("Request {}: indexed {} passages from {}", request.getId(), batch.size(), sourceId);
            return new IngestResult(sourceId, batch.size(), metadata);
        } catch (final RuntimeException e) {
            fail(request, e);
            throw e;
        } finally {
            adminLock.readLock().unlock();
        }
    }

    /**
     * Pages through the whole corpus under the shared lock, so a concurrent clear or
     * source deletion cannot shift the pages while they are being read.
     */
    private List<EmbeddedPassage> snapshotCorpus() {
        adminLock.readLock().lock();
        try {
            return vectorIndex.scanEverything();
        } finally {
            adminLock.readLock().unlock();
        }
    }

    private float[] embedQuestion(final String question) {
        final float[] vector;
        try {
            vector = embeddingProvider.embed(question);
        } catch (final RagException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new ProviderException("Question embedding failed: " + e.getMessage(), e);
        }
        if (vector == null) {
            throw new ProviderException("Embedding provider returned no vector");
        }
        if (VectorMath.isZeroMagnitude(vector)) {
            throw new ProviderException("Embedding provider returned a zero-magnitude vector for the question");
        }

        final OptionalInt dim = vectorIndex.dimension();
        if (dim.isPresent() && dim.getAsInt() != vector.length) {
            throw new DimensionMismatchException(dim.getAsInt(), vector.length);
        }
        return vector;
    }

    private String synthesize(final String question, final String context) {
        try {
            return answerSynthesizer.synthesize(question, context);
        } catch (final RagException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new ProviderException("Answer synthesis failed: " + e.getMessage(), e);
        }
    }

    private void fail(final RagRequest request, final RuntimeException e) {
        if (e instanceof ValidationException ve) {
            log.warn("Request {} ({}) rejected: {}", request.getId(), request.getKind(), ve.getMessage());
            registry.fail(request, ve.getKind(), ve.getMessage());
        } else if (e instanceof RagException re) {
            log.error("Request {} ({}) failed with {}", request.getId(), request.getKind(), re.getKind(), e);
            registry.fail(request, re.getKind(), e.getMessage());
        } else {
            log.error("Request {} ({}) failed", request.getId(), request.getKind(), e);
            registry.fail(request, null, e.getMessage());
        }
    }

    private void validateText(final String text) {
        requireNonBlank(text, "text");
        if (text.length() > config.getLimits().getMaxTextChars()) {
            throw new ValidationException("text",
                    "must be at most " + config.getLimits().getMaxTextChars() + " characters");
        }
    }

    static String buildContext(final List<ScoredPassage> hits) {
        final List<String> parts = new ArrayList<>(hits.size());
        for (final ScoredPassage hit : hits) {
            parts.add(hit.passage().content());
        }
        return String.join(CONTEXT_SEPARATOR, parts);
    }

    static String excerpt(final String content) {
        if (content.length() <= EXCERPT_LENGTH) {
            return content;
        }
        return content.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static void requireNonBlank(final String value, final String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException(field, "must not be blank");
        }
    }
}

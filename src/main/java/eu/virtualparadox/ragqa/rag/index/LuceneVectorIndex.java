package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.error.VectorIndexException;
import eu.virtualparadox.ragqa.ingest.model.Passage;
import eu.virtualparadox.ragqa.rag.index.model.CorpusPage;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.BytesRef;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

import static eu.virtualparadox.ragqa.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndex}, persisting the corpus across restarts.
 * <p>
 * Each passage is stored as one Lucene {@link Document}:
 * <ul>
 *   <li>{@code passageId} – {@link StringField}: unique key, used for idempotent replacement</li>
 *   <li>{@code sourceId} – {@link StringField}: origin, used for filtering, deletion and stats</li>
 *   <li>{@code text}, {@code sequence}, {@code startChar}, {@code endChar}, {@code wordCount},
 *   {@code section} – {@link StoredField}: the passage payload</li>
 *   <li>{@code vector} – {@link StoredField}: little-endian float bytes</li>
 *   <li>{@code ordinal} – {@link NumericDocValuesField}: insertion order, used to sort scans</li>
 * </ul>
 *
 * <p>Similarity is computed by the retriever over scanned pages, so vectors are stored rather than
 * HNSW-indexed. This also lifts Lucene's limit on indexed vector dimensions.</p>
 *
 * <p>Writes are serialized by a lock and committed per call; reads go through the
 * {@link SearcherManager} and see every committed write. The established dimension is kept in
 * the commit user data, so it survives {@link #clearAll()} followed by a restart.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "ragqa.index.type", havingValue = "lucene")
public final class LuceneVectorIndex implements VectorIndex {

    private static final Sort BY_ORDINAL = new Sort(new SortField(FIELD_ORDINAL, SortField.Type.LONG));
    private static final Sort BY_ORDINAL_DESC = new Sort(new SortField(FIELD_ORDINAL, SortField.Type.LONG, true));
    private static final String COMMIT_DIMENSION = "vectorDimension";

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final int pageSize;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Guarded by {@link #writeLock}.
     */
    private Integer vectorDim;
    private long nextOrdinal;

    public LuceneVectorIndex(final IndexWriter writer,
                             final SearcherManager searcherManager,
                             @Value("${ragqa.index.page-size:1000}") final int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.pageSize = pageSize;
        restoreState();
    }

    @Override
    public void upsert(final List<EmbeddedPassage> batch) {
        if (batch == null) {
            throw new ValidationException("passages", "must not be null");
        }
        if (batch.isEmpty()) {
            return;
        }

        writeLock.lock();
        try {
            final int dim = VectorDimensions.requireConsistent(batch, vectorDim);

            final IndexSearcher searcher = searcherManager.acquire();
            try {
                for (final EmbeddedPassage p : batch) {
                    final Long existing = ordinalOf(searcher, p.id());
                    final long ordinal = existing != null ? existing : nextOrdinal++;
                    writer.updateDocument(new Term(FIELD_PASSAGE_ID, p.id()), buildLuceneDocument(p, ordinal));
                }
            } finally {
                searcherManager.release(searcher);
            }

            vectorDim = dim;
            commit();
            log.debug("Upserted {} passages into Lucene index", batch.size());
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to upsert passages", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public CorpusPage scanAll(final int offset) {
        if (offset < 0) {
            throw new ValidationException("offset", "must not be negative");
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final int total = searcher.count(new MatchAllDocsQuery());
                if (offset >= total) {
                    return new CorpusPage(List.of(), -1);
                }
                final int end = Math.min(offset + pageSize, total);
                final List<EmbeddedPassage> page = search(searcher, new MatchAllDocsQuery(), offset, end);
                return new CorpusPage(page, end < total ? end : -1);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to scan the index", e);
        }
    }

    @Override
    public List<EmbeddedPassage> filterBySource(final String sourceId) {
        if (sourceId == null) {
            return List.of();
        }

        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final Query query = new TermQuery(new Term(FIELD_SOURCE_ID, sourceId));
                final int count = searcher.count(query);
                return count == 0 ? List.of() : search(searcher, query, 0, count);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to filter by source " + sourceId, e);
        }
    }

    @Override
    public int deleteBySource(final String sourceId) {
        if (sourceId == null) {
            return 0;
        }

        writeLock.lock();
        try {
            final Term term = new Term(FIELD_SOURCE_ID, sourceId);
            final int count;
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                count = searcher.count(new TermQuery(term));
            } finally {
                searcherManager.release(searcher);
            }
            if (count > 0) {
                writer.deleteDocuments(term);
                commit();
            }
            return count;
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to delete source " + sourceId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void clearAll() {
        writeLock.lock();
        try {
            writer.deleteAll();
            commit();
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to clear the index", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public IndexStats stats() {
        try {
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final int total = searcher.count(new MatchAllDocsQuery());
                final List<String> sources = new ArrayList<>();
                final Terms terms = MultiTerms.getTerms(searcher.getIndexReader(), FIELD_SOURCE_ID);
                if (terms != null) {
                    // terms of deleted documents linger until merged away, so count live hits
                    final TermsEnum it = terms.iterator();
                    BytesRef term;
                    while ((term = it.next()) != null) {
                        final String source = term.utf8ToString();
                        if (searcher.count(new TermQuery(new Term(FIELD_SOURCE_ID, source))) > 0) {
                            sources.add(source);
                        }
                    }
                }
                return new IndexStats(total, sources);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to compute index stats", e);
        }
    }

    @Override
    public OptionalInt dimension() {
        writeLock.lock();
        try {
            return vectorDim == null ? OptionalInt.empty() : OptionalInt.of(vectorDim);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Picks up the dimension and the next ordinal from an index opened in append mode.
     */
    private void restoreState() {
        try {
            if (DirectoryReader.indexExists(writer.getDirectory())) {
                final String stored = SegmentInfos.readLatestCommit(writer.getDirectory())
                        .getUserData().get(COMMIT_DIMENSION);
                if (stored != null) {
                    vectorDim = Integer.parseInt(stored);
                }
            }

            final IndexSearcher searcher = searcherManager.acquire();
            try {
                final TopDocs last = searcher.search(new MatchAllDocsQuery(), 1, BY_ORDINAL_DESC);
                if (last.scoreDocs.length > 0) {
                    final Document d = searcher.storedFields().document(last.scoreDocs[0].doc);
                    nextOrdinal = d.getField(FIELD_ORDINAL).numericValue().longValue() + 1;
                    vectorDim = decodeVector(d.getBinaryValue(FIELD_VECTOR)).length;
                    log.info("Opened Lucene index with {} passages of dimension {}",
                            searcher.count(new MatchAllDocsQuery()), vectorDim);
                }
            } finally {
                searcherManager.release(searcher);
            }
        } catch (final IOException e) {
            throw new VectorIndexException("Unable to open the index", e);
        }
    }

    /**
     * Commits pending writes together with the established dimension. Caller holds {@link #writeLock}.
     */
    private void commit() throws IOException {
        if (vectorDim != null) {
            writer.setLiveCommitData(Map.of(COMMIT_DIMENSION, Integer.toString(vectorDim)).entrySet());
        }
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private List<EmbeddedPassage> search(final IndexSearcher searcher,
                                         final Query query,
                                         final int from,
                                         final int to) throws IOException {
        final TopDocs hits = searcher.search(query, to, BY_ORDINAL);
        final StoredFields storedFields = searcher.storedFields();
        final List<EmbeddedPassage> result = new ArrayList<>(Math.max(0, to - from));
        final ScoreDoc[] docs = hits.scoreDocs;
        for (int i = from; i < docs.length && i < to; i++) {
            result.add(toEmbeddedPassage(storedFields.document(docs[i].doc)));
        }
        return result;
    }

    private Long ordinalOf(final IndexSearcher searcher, final String passageId) throws IOException {
        final TopDocs hit = searcher.search(new TermQuery(new Term(FIELD_PASSAGE_ID, passageId)), 1);
        if (hit.scoreDocs.length == 0) {
            return null;
        }
        return searcher.storedFields().document(hit.scoreDocs[0].doc)
                .getField(FIELD_ORDINAL).numericValue().longValue();
    }

    private Document buildLuceneDocument(final EmbeddedPassage ep, final long ordinal) {
        final Passage p = ep.passage();
        final Document d = new Document();

        d.add(new StringField(FIELD_PASSAGE_ID, p.id(), Field.Store.YES));
        if (p.sourceId() != null) {
            d.add(new StringField(FIELD_SOURCE_ID, p.sourceId(), Field.Store.YES));
        }

        d.add(new StoredField(FIELD_TEXT, p.content()));
        d.add(new StoredField(FIELD_SEQUENCE, p.index()));
        d.add(new StoredField(FIELD_START_CHAR, p.startChar()));
        d.add(new StoredField(FIELD_END_CHAR, p.endChar()));
        d.add(new StoredField(FIELD_WORD_COUNT, p.wordCount()));
        if (p.section() != null) {
            d.add(new StoredField(FIELD_SECTION, p.section()));
        }

        d.add(new StoredField(FIELD_VECTOR, encodeVector(ep.vectorView())));

        d.add(new NumericDocValuesField(FIELD_ORDINAL, ordinal));
        d.add(new StoredField(FIELD_ORDINAL, ordinal));
        return d;
    }

    private EmbeddedPassage toEmbeddedPassage(final Document d) {
        final Passage passage = new Passage(
                d.get(FIELD_PASSAGE_ID),
                d.get(FIELD_TEXT),
                d.getField(FIELD_SEQUENCE).numericValue().intValue(),
                d.getField(FIELD_START_CHAR).numericValue().intValue(),
                d.getField(FIELD_END_CHAR).numericValue().intValue(),
                d.getField(FIELD_WORD_COUNT).numericValue().intValue(),
                d.get(FIELD_SOURCE_ID),
                d.get(FIELD_SECTION));
        return new EmbeddedPassage(passage, decodeVector(d.getBinaryValue(FIELD_VECTOR)));
    }

    private static byte[] encodeVector(final float[] vector) {
        final ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(vector);
        return buffer.array();
    }

    private static float[] decodeVector(final BytesRef bytes) {
        final float[] vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .asFloatBuffer()
                .get(vector);
        return vector;
    }
}

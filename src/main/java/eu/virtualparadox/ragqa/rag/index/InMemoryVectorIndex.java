package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.error.ValidationException;
import eu.virtualparadox.ragqa.rag.index.model.CorpusPage;
import eu.virtualparadox.ragqa.rag.index.model.EmbeddedPassage;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link VectorIndex}. The corpus lives in an insertion-ordered map keyed by
 * passage id, guarded by a read/write lock: scans and stats share the read lock, mutations
 * take the write lock. Nothing survives a restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "ragqa.index.type", havingValue = "memory", matchIfMissing = true)
public final class InMemoryVectorIndex implements VectorIndex {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, EmbeddedPassage> passages = new LinkedHashMap<>();
    private final int pageSize;

    /**
     * Guarded by {@link #lock}. Established by the first upsert, kept across {@link #clearAll()}.
     */
    private Integer vectorDim;

    public InMemoryVectorIndex(@Value("${ragqa.index.page-size:1000}") final int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
    }

    @Override
    public void upsert(final List<EmbeddedPassage> batch) {
        if (batch == null) {
            throw new ValidationException("passages", "must not be null");
        }
        if (batch.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            vectorDim = VectorDimensions.requireConsistent(batch, vectorDim);
            for (final EmbeddedPassage p : batch) {
                passages.put(p.id(), p);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Upserted {} passages", batch.size());
    }

    @Override
    public CorpusPage scanAll(final int offset) {
        if (offset < 0) {
            throw new ValidationException("offset", "must not be negative");
        }

        lock.readLock().lock();
        try {
            final int size = passages.size();
            if (offset >= size) {
                return new CorpusPage(List.of(), -1);
            }

            final int end = Math.min(offset + pageSize, size);
            final List<EmbeddedPassage> page = new ArrayList<>(end - offset);
            final Iterator<EmbeddedPassage> it = passages.values().iterator();
            for (int i = 0; i < end; i++) {
                final EmbeddedPassage p = it.next();
                if (i >= offset) {
                    page.add(p);
                }
            }
            return new CorpusPage(page, end < size ? end : -1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<EmbeddedPassage> filterBySource(final String sourceId) {
        lock.readLock().lock();
        try {
            final List<EmbeddedPassage> result = new ArrayList<>();
            for (final EmbeddedPassage p : passages.values()) {
                if (sourceId != null && sourceId.equals(p.sourceId())) {
                    result.add(p);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deleteBySource(final String sourceId) {
        lock.writeLock().lock();
        try {
            final int before = passages.size();
            passages.values().removeIf(p -> sourceId != null && sourceId.equals(p.sourceId()));
            return before - passages.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clearAll() {
        lock.writeLock().lock();
        try {
            passages.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public IndexStats stats() {
        lock.readLock().lock();
        try {
            final Set<String> sources = new TreeSet<>();
            for (final EmbeddedPassage p : passages.values()) {
                if (p.sourceId() != null) {
                    sources.add(p.sourceId());
                }
            }
            return new IndexStats(passages.size(), new ArrayList<>(sources));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public OptionalInt dimension() {
        lock.readLock().lock();
        try {
            return vectorDim == null ? OptionalInt.empty() : OptionalInt.of(vectorDim);
        } finally {
            lock.readLock().unlock();
        }
    }
}

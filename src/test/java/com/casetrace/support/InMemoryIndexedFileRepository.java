package com.casetrace.support;

import com.casetrace.domain.IndexedFile;
import com.casetrace.domain.ProcessingStatus;
import com.casetrace.storage.IndexedFileRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Row store with the same guarded-write semantics as the JDBC repository.
 * Rows are copied in and out so callers never share instances with the store.
 */
public class InMemoryIndexedFileRepository implements IndexedFileRepository {

    private final Map<Long, IndexedFile> rows = new TreeMap<>();
    private final Set<Long> failOnWrite = new HashSet<>();
    private int writes;

    public synchronized IndexedFile save(IndexedFile file) {
        rows.put(file.getId(), new IndexedFile(file));
        return file;
    }

    public synchronized IndexedFile get(long id) {
        IndexedFile row = rows.get(id);
        return row != null ? new IndexedFile(row) : null;
    }

    /**
     * Make any guarded write to this file throw, as a broken connection would.
     */
    public synchronized void failOnWrite(long id) {
        failOnWrite.add(id);
    }

    public synchronized int getWrites() {
        return writes;
    }

    synchronized Map<Long, IndexedFile> snapshot() {
        Map<Long, IndexedFile> copy = new TreeMap<>();
        rows.forEach((id, row) -> copy.put(id, new IndexedFile(row)));
        return copy;
    }

    synchronized void restore(Map<Long, IndexedFile> snapshot) {
        rows.clear();
        rows.putAll(snapshot);
    }

    @Override
    public synchronized Optional<IndexedFile> findById(long id) {
        return Optional.ofNullable(get(id));
    }

    @Override
    public synchronized List<IndexedFile> findActive(Long caseId) {
        return rows.values().stream()
            .filter(row -> !row.isDeleted())
            .filter(row -> caseId == null || row.getCaseId() == caseId)
            .map(IndexedFile::new)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<IndexedFile> findActiveByStatus(String status) {
        return rows.values().stream()
            .filter(row -> !row.isDeleted())
            .filter(row -> Objects.equals(row.getIndexingStatus(), status))
            .map(IndexedFile::new)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (IndexedFile row : rows.values()) {
            if (!row.isDeleted()) {
                counts.merge(row.getIndexingStatus(), 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public synchronized boolean compareAndSet(IndexedFile expected, IndexedFile updated) {
        if (failOnWrite.contains(expected.getId())) {
            throw new IllegalStateException("connection reset while writing file " + expected.getId());
        }
        IndexedFile row = rows.get(expected.getId());
        if (row == null
            || !Objects.equals(row.getIndexingStatus(), expected.getIndexingStatus())
            || !Objects.equals(row.getTaskId(), expected.getTaskId())) {
            return false;
        }
        if (updated.hasStatus(ProcessingStatus.COMPLETED)) {
            updated.setTaskId(null);
        }
        IndexedFile stored = new IndexedFile(updated);
        stored.setUpdatedAt(Instant.now());
        rows.put(expected.getId(), stored);
        writes++;
        return true;
    }

    public synchronized List<IndexedFile> all() {
        return new ArrayList<>(snapshot().values());
    }
}

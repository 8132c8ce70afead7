package com.casetrace.storage;

import com.casetrace.domain.IndexedFile;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to persisted per-file processing state.
 *
 * State changes go through {@link #compareAndSet}, so a worker and a repair
 * pass racing on the same row cannot both win.
 */
public interface IndexedFileRepository {

    Optional<IndexedFile> findById(long id);

    /**
     * Non-deleted files, optionally limited to one case.
     */
    List<IndexedFile> findActive(Long caseId);

    List<IndexedFile> findActiveByStatus(String status);

    /**
     * Non-deleted file counts keyed by raw status string
     */
    Map<String, Long> countByStatus();

    /**
     * Write {@code updated} only if the row still has the status and task id
     * of {@code expected}. A {@code Completed} status is always written with
     * no task id.
     *
     * @return true when the row was updated
     */
    boolean compareAndSet(IndexedFile expected, IndexedFile updated);
}

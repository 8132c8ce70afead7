package com.casetrace.ingestion;

import com.casetrace.domain.IndexedFile;

/**
 * Rule engine run over a file's documents once they are indexed.
 *
 * Implementations flag matching documents in the index themselves
 * ({@code has_sigma}, {@code has_ioc}, {@code ioc_count}) and report counts
 * for the file row.
 */
public interface DetectionStage {

    enum Phase {
        SIGMA,
        IOC
    }

    Phase phase();

    String name();

    DetectionResult run(IndexedFile file, String index);
}

package com.casetrace.ingestion;

import com.casetrace.domain.IndexedFile;
import com.casetrace.domain.ProcessingStatus;
import com.casetrace.query.LatestEventTimestampResolver;
import com.casetrace.storage.IndexedFileRepository;
import com.casetrace.storage.hot.IndexNames;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.tasks.FileProcessingTask;
import com.casetrace.tasks.TaskQueue;
import com.casetrace.tasks.TaskQueueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Rebuilds a case index from its source files. This is the remedy for an
 * index written by an incompatible version.
 */
@Service
public class CaseReindexService {
    private static final Logger log = LoggerFactory.getLogger(CaseReindexService.class);

    private final IndexedFileRepository repository;
    private final SearchEngineClient engine;
    private final TaskQueue taskQueue;
    private final LatestEventTimestampResolver latestEventResolver;

    @Value("${casetrace.tasks.inspect-timeout-ms:5000}")
    private long inspectTimeoutMs = 5000;

    public CaseReindexService(IndexedFileRepository repository, SearchEngineClient engine,
                              TaskQueue taskQueue, LatestEventTimestampResolver latestEventResolver) {
        this.repository = repository;
        this.engine = engine;
        this.taskQueue = taskQueue;
        this.latestEventResolver = latestEventResolver;
    }

    /**
     * Delete the case index, reset every file of the case to {@code Queued}
     * and submit it again.
     *
     * @return number of files submitted
     * @throws IllegalStateException when a file of the case is still being processed
     */
    public int reindexCase(long caseId) {
        String index = IndexNames.forCase(caseId);
        List<IndexedFile> files = repository.findActive(caseId);

        TaskQueueSnapshot snapshot = taskQueue.snapshot(Duration.ofMillis(inspectTimeoutMs));
        for (IndexedFile file : files) {
            if (snapshot.isLive(file.getTaskId())) {
                throw new IllegalStateException("File " + file.getId() + " of case " + caseId
                    + " is still being processed by task " + file.getTaskId());
            }
        }

        boolean deleted = engine.deleteIndex(index);
        latestEventResolver.invalidate(caseId);
        log.info("Re-indexing case {}: index {} {}, {} files", caseId, index,
            deleted ? "deleted" : "did not exist", files.size());

        int submitted = 0;
        for (IndexedFile file : files) {
            IndexedFile queued = new IndexedFile(file);
            queued.setIndexingStatus(ProcessingStatus.QUEUED.getValue());
            queued.setEventCount(0);
            queued.setViolationCount(0);
            queued.setSigmaEventCount(0);
            queued.setIocEventCount(0);
            queued.setIndexed(false);
            queued.setIndexKey(null);
            queued.setTaskId(UUID.randomUUID().toString());

            if (!repository.compareAndSet(file, queued)) {
                log.warn("File {} changed during re-index of case {}, not resubmitted", file.getId(), caseId);
                continue;
            }
            taskQueue.submit(new FileProcessingTask(queued.getTaskId(), file.getId(), caseId));
            submitted++;
        }
        log.info("Re-index of case {} submitted {} of {} files", caseId, submitted, files.size());
        return submitted;
    }
}

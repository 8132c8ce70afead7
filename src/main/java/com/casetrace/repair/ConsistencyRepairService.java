package com.casetrace.repair;

import com.casetrace.domain.IndexedFile;
import com.casetrace.domain.ProcessingStatus;
import com.casetrace.storage.IndexedFileRepository;
import com.casetrace.storage.hot.IndexNames;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.storage.hot.SearchEngineException;
import com.casetrace.tasks.FileProcessingTask;
import com.casetrace.tasks.TaskQueue;
import com.casetrace.tasks.TaskQueueSnapshot;
import com.casetrace.tasks.TaskQueueUnavailableException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reconciles persisted file state with the task queue and the case indices.
 *
 * <p>A pass works case by case. Every detection for a case is planned first,
 * including the index existence checks, and the resulting writes are applied
 * in one transaction. Writes are guarded on the status and task id that were
 * read, so a worker that moves a file mid-pass wins and the repair of that
 * file is skipped. Files whose task is running or waiting are never touched.
 */
@Service
public class ConsistencyRepairService {
    private static final Logger log = LoggerFactory.getLogger(ConsistencyRepairService.class);

    private static final String PREFIX = "[REPAIR]";

    private final IndexedFileRepository repository;
    private final SearchEngineClient engine;
    private final TaskQueue taskQueue;
    private final TransactionOperations transactions;
    private final RepairMetrics metrics;
    private final Clock clock;

    @Value("${casetrace.tasks.inspect-timeout-ms:5000}")
    private long inspectTimeoutMs = 5000;

    @Autowired
    public ConsistencyRepairService(IndexedFileRepository repository, SearchEngineClient engine,
                                    TaskQueue taskQueue, TransactionOperations transactions,
                                    RepairMetrics metrics) {
        this(repository, engine, taskQueue, transactions, metrics, Clock.systemUTC());
    }

    ConsistencyRepairService(IndexedFileRepository repository, SearchEngineClient engine,
                             TaskQueue taskQueue, TransactionOperations transactions,
                             RepairMetrics metrics, Clock clock) {
        this.repository = repository;
        this.engine = engine;
        this.taskQueue = taskQueue;
        this.transactions = transactions;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run one repair pass.
     *
     * @throws RepairAbortedException when the task queue cannot be inspected;
     *         nothing has been written in that case
     */
    public RepairReport runRepair(RepairOptions options) {
        RepairReport report = new RepairReport(options.isDryRun(), Instant.now(clock));
        Timer.Sample sample = metrics.startRun();
        log.info("{} Starting pass {}", PREFIX, options);

        // rows first: every task a row names was submitted before the snapshot
        Map<Long, List<IndexedFile>> byCase = new LinkedHashMap<>();
        for (IndexedFile file : repository.findActive(options.getCaseId().orElse(null))) {
            byCase.computeIfAbsent(file.getCaseId(), id -> new ArrayList<>()).add(file);
        }

        TaskQueueSnapshot snapshot;
        try {
            snapshot = taskQueue.snapshot(Duration.ofMillis(inspectTimeoutMs));
        } catch (TaskQueueUnavailableException e) {
            metrics.recordAborted();
            log.error("{} Task queue could not be inspected, aborting pass without changes", PREFIX, e);
            throw new RepairAbortedException("Task liveness unknown: " + e.getMessage(), e);
        }
        log.info("{} Queue snapshot: {}", PREFIX, snapshot);

        List<IndexedFile> plannedRequeues = new ArrayList<>();
        for (Map.Entry<Long, List<IndexedFile>> entry : byCase.entrySet()) {
            report.incrementCasesScanned();
            report.addFilesScanned(entry.getValue().size());
            repairCase(entry.getKey(), entry.getValue(), snapshot, options, report, plannedRequeues);
        }

        requeueStuckFiles(options, report, plannedRequeues);

        report.setFinishedAt(Instant.now(clock));
        metrics.recordRunFinished(sample);
        if (report.isClean()) {
            log.info("{} Pass complete, nothing to repair ({} files in {} cases)",
                PREFIX, report.getFilesScanned(), report.getCasesScanned());
        } else {
            log.warn("{} Pass complete: {}", PREFIX, report);
        }
        return report;
    }

    private void repairCase(long caseId, List<IndexedFile> files, TaskQueueSnapshot snapshot,
                            RepairOptions options, RepairReport report, List<IndexedFile> plannedRequeues) {
        List<RepairAction> plan;
        try {
            plan = planCase(caseId, files, snapshot, options);
        } catch (SearchEngineException e) {
            report.incrementFailedBatches();
            metrics.recordFailedBatch();
            log.error("{} Could not plan case {}: index state unknown, skipping it this pass", PREFIX, caseId, e);
            return;
        }
        if (plan.isEmpty()) {
            return;
        }
        plan.forEach(report::addAction);

        if (options.isDryRun()) {
            for (RepairAction action : plan) {
                action.setOutcome(RepairOutcome.WOULD_APPLY);
                log.warn("{} Would apply {}", PREFIX, action);
                if (action.getUpdated().hasStatus(ProcessingStatus.QUEUED)) {
                    plannedRequeues.add(action.getUpdated());
                }
            }
            return;
        }

        try {
            transactions.executeWithoutResult(status -> {
                for (RepairAction action : plan) {
                    boolean written = repository.compareAndSet(action.getExpected(), action.getUpdated());
                    action.setOutcome(written ? RepairOutcome.APPLIED : RepairOutcome.SKIPPED_CONCURRENT_CHANGE);
                }
            });
        } catch (RuntimeException e) {
            report.incrementFailedBatches();
            metrics.recordFailedBatch();
            log.error("{} Batch for case {} rolled back", PREFIX, caseId, e);
            for (RepairAction action : plan) {
                action.setOutcome(RepairOutcome.ROLLED_BACK);
                log.error("{} Not committed: {}", PREFIX, action);
            }
            return;
        }

        for (RepairAction action : plan) {
            if (action.getOutcome() == RepairOutcome.APPLIED) {
                metrics.recordApplied(action.getDetection());
                log.warn("{} Applied {}", PREFIX, action);
            } else {
                metrics.recordConcurrentSkip();
                log.info("{} Skipped, file changed concurrently: {}", PREFIX, action);
            }
        }
    }

    /**
     * Decide at most one action per file. Reads index state but writes nothing.
     */
    List<RepairAction> planCase(long caseId, List<IndexedFile> files, TaskQueueSnapshot snapshot,
                                RepairOptions options) {
        String index = IndexNames.forCase(caseId);
        Boolean indexExists = null;
        Optional<Instant> lookbackStart = options.getLookback().map(window -> Instant.now(clock).minus(window));
        List<RepairAction> plan = new ArrayList<>();

        for (IndexedFile file : files) {
            if (snapshot.isLive(file.getTaskId())) {
                continue;
            }
            String status = file.getIndexingStatus();

            if (isMisclassifiedEmpty(file)) {
                IndexedFile updated = new IndexedFile(file);
                updated.setIndexingStatus(ProcessingStatus.COMPLETED.getValue());
                updated.setHidden(true);
                updated.setIndexed(true);
                updated.setTaskId(null);
                plan.add(found(new RepairAction(RepairDetection.ZERO_EVENT_MISCLASSIFIED, file, updated,
                    "failed with " + file.getEventCount() + " event(s), completing as hidden")));
                continue;
            }

            if (ProcessingStatus.isInFlight(status)) {
                IndexedFile updated = new IndexedFile(file);
                updated.setIndexingStatus(ProcessingStatus.QUEUED.getValue());
                updated.setTaskId(null);
                plan.add(found(new RepairAction(RepairDetection.STUCK_PROCESSING, file, updated,
                    "task " + file.getTaskId() + " is not running or waiting, back to the queue")));
                continue;
            }

            if (file.hasStatus(ProcessingStatus.COMPLETED) && !file.isHidden() && file.getEventCount() > 0
                && withinLookback(file, lookbackStart)) {
                if (indexExists == null) {
                    indexExists = engine.indexExists(index);
                }
                if (!indexExists) {
                    plan.add(found(new RepairAction(RepairDetection.MISSING_INDEX, file, resetForReindex(file),
                        file.getEventCount() + " events recorded but " + index + " is missing, reprocessing")));
                    continue;
                }
            }

            if (file.getEventCount() > 0 && !file.isIndexed()) {
                if (indexExists == null) {
                    indexExists = engine.indexExists(index);
                }
                if (indexExists) {
                    IndexedFile updated = new IndexedFile(file);
                    updated.setIndexed(true);
                    plan.add(found(new RepairAction(RepairDetection.FLAG_INCONSISTENT, file, updated,
                        "events present in " + index + ", setting indexed flag")));
                } else {
                    plan.add(found(new RepairAction(RepairDetection.FLAG_INCONSISTENT, file, resetForReindex(file),
                        "not indexed and " + index + " is missing, reprocessing")));
                }
            }
        }
        return plan;
    }

    private void requeueStuckFiles(RepairOptions options, RepairReport report, List<IndexedFile> plannedRequeues) {
        Map<Long, IndexedFile> candidates = new LinkedHashMap<>();
        for (IndexedFile file : repository.findActiveByStatus(ProcessingStatus.QUEUED.getValue())) {
            if (options.getCaseId().map(id -> id == file.getCaseId()).orElse(true)) {
                candidates.put(file.getId(), file);
            }
        }
        for (IndexedFile file : plannedRequeues) {
            candidates.putIfAbsent(file.getId(), file);
        }
        if (candidates.isEmpty()) {
            return;
        }

        // the pass snapshot predates these rows
        TaskQueueSnapshot snapshot;
        try {
            snapshot = taskQueue.snapshot(Duration.ofMillis(inspectTimeoutMs));
        } catch (TaskQueueUnavailableException e) {
            log.warn("{} Task queue could not be inspected again, not requeueing this pass", PREFIX, e);
            return;
        }
        if (!snapshot.isIdle()) {
            log.debug("{} Queue has {} active and {} pending tasks, not requeueing",
                PREFIX, snapshot.activeCount(), snapshot.pendingCount());
            return;
        }
        log.warn("{} Queue is idle but {} file(s) are queued", PREFIX, candidates.size());

        for (IndexedFile file : candidates.values()) {
            if (snapshot.isLive(file.getTaskId())) {
                continue;
            }
            IndexedFile updated = new IndexedFile(file);
            updated.setTaskId(UUID.randomUUID().toString());
            RepairAction action = new RepairAction(RepairDetection.STUCK_QUEUED, file, updated,
                "resubmitting as task " + updated.getTaskId());
            report.addAction(action);

            if (options.isDryRun()) {
                action.setOutcome(RepairOutcome.WOULD_APPLY);
                log.warn("{} Would apply {}", PREFIX, action);
                continue;
            }
            if (!repository.compareAndSet(file, updated)) {
                action.setOutcome(RepairOutcome.SKIPPED_CONCURRENT_CHANGE);
                metrics.recordConcurrentSkip();
                log.info("{} Skipped, file changed concurrently: {}", PREFIX, action);
                continue;
            }
            try {
                taskQueue.submit(new FileProcessingTask(updated.getTaskId(), file.getId(), file.getCaseId()));
                action.setOutcome(RepairOutcome.APPLIED);
                metrics.recordApplied(RepairDetection.STUCK_QUEUED);
                log.warn("{} Applied {}", PREFIX, action);
            } catch (TaskQueueUnavailableException e) {
                action.setOutcome(RepairOutcome.SUBMIT_FAILED);
                log.error("{} Could not submit file {}, it will be retried next pass", PREFIX, file.getId(), e);
            }
        }
    }

    /**
     * Failed with no events, or with the single record of a collection
     * artifact. Index version mismatches are left for an explicit re-index.
     */
    static boolean isMisclassifiedEmpty(IndexedFile file) {
        String status = file.getIndexingStatus();
        if (!ProcessingStatus.isFailed(status) || ProcessingStatus.VERSION_MISMATCH.equals(status)) {
            return false;
        }
        if (file.getEventCount() == 0) {
            return true;
        }
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename().toLowerCase(Locale.ROOT) : "";
        return file.getEventCount() == 1 && "JSON".equals(file.getFileType()) && !name.endsWith(".evtx");
    }

    private static boolean withinLookback(IndexedFile file, Optional<Instant> lookbackStart) {
        if (lookbackStart.isEmpty()) {
            return true;
        }
        return file.getUpdatedAt() != null && !file.getUpdatedAt().isBefore(lookbackStart.get());
    }

    private static IndexedFile resetForReindex(IndexedFile file) {
        IndexedFile updated = new IndexedFile(file);
        updated.setIndexingStatus(ProcessingStatus.QUEUED.getValue());
        updated.setEventCount(0);
        updated.setViolationCount(0);
        updated.setSigmaEventCount(0);
        updated.setIocEventCount(0);
        updated.setIndexed(false);
        updated.setIndexKey(null);
        updated.setTaskId(null);
        return updated;
    }

    private static RepairAction found(RepairAction action) {
        log.warn("{} Found {}", PREFIX, action);
        return action;
    }
}

package com.casetrace.ingestion;

import com.casetrace.dedup.DedupKey;
import com.casetrace.dedup.DedupKeyGenerator;
import com.casetrace.domain.IndexedFile;
import com.casetrace.domain.NormalizedFields;
import com.casetrace.domain.ProcessingStatus;
import com.casetrace.domain.SourceFormat;
import com.casetrace.domain.SourceRecord;
import com.casetrace.normalization.FieldNormalizer;
import com.casetrace.normalization.SearchBlobBuilder;
import com.casetrace.normalization.SourceFormatDetector;
import com.casetrace.query.LatestEventTimestampResolver;
import com.casetrace.query.SearchQueryBuilder;
import com.casetrace.storage.IndexedFileRepository;
import com.casetrace.storage.hot.BulkIndexResult;
import com.casetrace.storage.hot.CompatibilityExplanation;
import com.casetrace.storage.hot.CompatibilityResult;
import com.casetrace.storage.hot.IndexCompatibilityGate;
import com.casetrace.storage.hot.IndexNames;
import com.casetrace.storage.hot.IndexingMetrics;
import com.casetrace.storage.hot.SearchEngineClient;
import com.casetrace.tasks.FileProcessingTask;
import com.casetrace.tasks.FileTaskHandler;
import io.micrometer.core.instrument.Timer;
import org.opensearch.index.query.QueryBuilders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Indexes one uploaded file into its case index and walks the file row
 * through the processing states.
 *
 * <p>Every state change is a guarded write on the row's status and task id.
 * When a guarded write loses, another actor owns the file and this run stops
 * without touching it further.
 */
@Service
public class FileIndexingService implements FileTaskHandler {
    private static final Logger log = LoggerFactory.getLogger(FileIndexingService.class);

    static final String NOTHING_INDEXED_STATUS = "Failed: 0 events indexed";

    static final String SOURCE_FILE_FIELD = "source_file";
    static final String FILE_ID_FIELD = "file_id";
    static final String CASE_ID_FIELD = "case_id";
    static final String INDEX_KEY_FIELD = "opensearch_key";
    static final String DEDUP_KEY_FIELD = "event_dedup_key";

    private final IndexedFileRepository repository;
    private final SearchEngineClient engine;
    private final IndexCompatibilityGate gate;
    private final SourceFormatDetector formatDetector;
    private final FieldNormalizer normalizer;
    private final SearchBlobBuilder blobBuilder;
    private final DedupKeyGenerator dedupKeyGenerator;
    private final RecordReader recordReader;
    private final IndexingMetrics metrics;
    private final LatestEventTimestampResolver latestEventResolver;
    private final ObjectProvider<DetectionStage> detectionStages;

    @Value("${casetrace.ingestion.bulk-size:1000}")
    private int bulkSize = 1000;

    @Value("${casetrace.ingestion.marker-retry-attempts:3}")
    private int markerRetryAttempts = 3;

    @Value("${casetrace.ingestion.marker-retry-delay-ms:500}")
    private long markerRetryDelayMs = 500;

    public FileIndexingService(IndexedFileRepository repository,
                               SearchEngineClient engine,
                               IndexCompatibilityGate gate,
                               SourceFormatDetector formatDetector,
                               FieldNormalizer normalizer,
                               SearchBlobBuilder blobBuilder,
                               DedupKeyGenerator dedupKeyGenerator,
                               RecordReader recordReader,
                               IndexingMetrics metrics,
                               LatestEventTimestampResolver latestEventResolver,
                               ObjectProvider<DetectionStage> detectionStages) {
        this.repository = repository;
        this.engine = engine;
        this.gate = gate;
        this.formatDetector = formatDetector;
        this.normalizer = normalizer;
        this.blobBuilder = blobBuilder;
        this.dedupKeyGenerator = dedupKeyGenerator;
        this.recordReader = recordReader;
        this.metrics = metrics;
        this.latestEventResolver = latestEventResolver;
        this.detectionStages = detectionStages;
    }

    @Override
    public void handle(FileProcessingTask task) {
        indexFile(task.getFileId(), task.getTaskId());
    }

    /**
     * Index a file under the given task.
     *
     * @return the file row as last written by this run
     * @throws IndexIncompatibleException when the case index must be rebuilt first
     * @throws FileIndexingException when reading or writing failed; the row is marked failed
     */
    public IndexedFile indexFile(long fileId, String taskId) {
        IndexedFile file = repository.findById(fileId)
            .orElseThrow(() -> new IllegalArgumentException("No indexed file with id " + fileId));

        if (!Objects.equals(file.getTaskId(), taskId)) {
            log.warn("File {} is owned by task {}, not {}; skipping", fileId, file.getTaskId(), taskId);
            return file;
        }

        long caseId = file.getCaseId();
        String index = IndexNames.forCase(caseId);
        Timer.Sample sample = metrics.startFileTimer();

        CompatibilityResult compatibility = checkCompatibility(caseId);
        if (!compatibility.isCompatible()) {
            CompatibilityExplanation explanation = gate.explain(compatibility);
            log.error("Refusing to index file {} into {}: {}", fileId, index, explanation.getMessage());
            markFailed(file, ProcessingStatus.VERSION_MISMATCH);
            metrics.recordFileFailed(sample);
            throw new IndexIncompatibleException(caseId, explanation);
        }

        // no marker read means this run may create the index and must stamp it
        boolean firstWrite = compatibility.getStoredVersion().isEmpty();
        if (firstWrite) {
            gate.beginFirstWrite(caseId);
        }
        try {
            return claimAndIndex(file, index, new IndexRun(caseId, !firstWrite), sample);
        } finally {
            if (firstWrite) {
                gate.endFirstWrite(caseId);
            }
        }
    }

    private IndexedFile claimAndIndex(IndexedFile file, String index, IndexRun run, Timer.Sample sample) {
        long fileId = file.getId();
        String indexKey = indexKey(run.caseId, file.getOriginalFilename());
        IndexedFile claimed = new IndexedFile(file);
        claimed.setIndexingStatus(ProcessingStatus.INDEXING.getValue());
        claimed.setFileType(fileTypeLabel(file.getOriginalFilename()));
        claimed.setIndexKey(indexKey);
        claimed.setIndexed(false);
        claimed.setHidden(false);
        claimed.setEventCount(0);
        claimed.setViolationCount(0);
        claimed.setSigmaEventCount(0);
        claimed.setIocEventCount(0);
        if (!repository.compareAndSet(file, claimed)) {
            log.warn("File {} changed before it could be claimed by task {}", fileId, file.getTaskId());
            return repository.findById(fileId).orElse(file);
        }
        log.info("Indexing file {} ({}) into {} under task {}", fileId, file.getOriginalFilename(), index, file.getTaskId());

        IndexedFile current = claimed;
        try {
            writeDocuments(current, index, indexKey, run);

            if (run.parsed > 0 && run.indexed == 0) {
                log.error("Parsed {} events from file {} but indexed none", run.parsed, fileId);
                markFailed(current, NOTHING_INDEXED_STATUS);
                metrics.recordFileFailed(sample);
                throw new FileIndexingException(fileId, "Indexing failed: 0 of " + run.parsed + " events indexed", null);
            }

            latestEventResolver.invalidate(run.caseId);

            if (shouldHide(current, run.indexed)) {
                IndexedFile hidden = completedCopy(current, run.indexed);
                hidden.setHidden(true);
                if (run.indexed > 0) {
                    engine.updateByQuery(index, QueryBuilders.termQuery(FILE_ID_FIELD, fileId),
                        Map.of(SearchQueryBuilder.HIDDEN_FIELD, true));
                }
                log.warn("File {} has {} event(s), completing it as hidden", fileId, run.indexed);
                return finish(current, hidden, sample);
            }

            IndexedFile indexed = new IndexedFile(current);
            indexed.setEventCount(run.indexed);
            indexed.setIndexed(true);

            current = advance(current, indexed, ProcessingStatus.SIGMA_TESTING);
            if (current == null) {
                return repository.findById(fileId).orElse(file);
            }
            runStages(DetectionStage.Phase.SIGMA, current, index);

            current = advance(current, new IndexedFile(current), ProcessingStatus.IOC_HUNTING);
            if (current == null) {
                return repository.findById(fileId).orElse(file);
            }
            runStages(DetectionStage.Phase.IOC, current, index);

            return finish(current, completedCopy(current, run.indexed), sample);

        } catch (FileIndexingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Indexing of file {} failed", fileId, e);
            markFailed(current, ProcessingStatus.FAILED);
            metrics.recordFileFailed(sample);
            throw new FileIndexingException(fileId, "Indexing failed: " + e.getMessage(), e);
        }
    }

    /**
     * Check the case index, giving another process that is creating it a
     * short while to write its marker.
     */
    private CompatibilityResult checkCompatibility(long caseId) {
        CompatibilityResult result = gate.checkCompatible(caseId);
        for (int attempt = 1; attempt < markerRetryAttempts && awaitsMarker(result); attempt++) {
            log.info("Index of case {} has no version marker yet, checking again in {} ms", caseId, markerRetryDelayMs);
            if (!pause()) {
                break;
            }
            result = gate.checkCompatible(caseId);
        }
        return result;
    }

    private static boolean awaitsMarker(CompatibilityResult result) {
        return !result.isCompatible()
            && !result.isMarkerUnreadable()
            && result.getStoredVersion().filter(IndexCompatibilityGate.NO_MARKER::equals).isPresent();
    }

    private void writeDocuments(IndexedFile file, String index, String indexKey, IndexRun run) throws IOException {
        SourceFormat fileFormat = formatDetector.detectFile(file.getOriginalFilename());
        Map<String, Map<String, Object>> batch = new LinkedHashMap<>();

        long parsed = recordReader.read(Path.of(file.getFilePath()), fileFormat, fields -> {
            fields.put(SOURCE_FILE_FIELD, file.getOriginalFilename());
            fields.put(FILE_ID_FIELD, file.getId());
            fields.put(CASE_ID_FIELD, file.getCaseId());
            fields.put(INDEX_KEY_FIELD, indexKey);

            SourceRecord record = formatDetector.wrap(fileFormat, fields);
            fields.put(SearchQueryBuilder.FORMAT_FIELD, record.getFormat().getLabel());

            NormalizedFields normalized = normalizer.normalizeInPlace(record);
            blobBuilder.attach(fields);

            DedupKey key = dedupKeyGenerator.dedupKey(file.getCaseId(), normalized, record);
            if (key.isRawFallback()) {
                log.warn("Event in file {} has no payload or normalized fields, keyed on its raw content", file.getId());
            }
            fields.put(DEDUP_KEY_FIELD, key.getValue());
            batch.put(key.getValue(), fields);

            if (batch.size() >= bulkSize) {
                flush(index, batch, run);
            }
        });
        flush(index, batch, run);

        run.parsed = parsed;
        log.info("Parsed {} events from file {}, indexed {} into {}", parsed, file.getId(), run.indexed, index);
    }

    private void flush(String index, Map<String, Map<String, Object>> batch, IndexRun run) {
        if (batch.isEmpty()) {
            return;
        }
        BulkIndexResult result = engine.bulkIndex(index, batch);
        run.indexed += result.getSucceeded();
        if (result.hasFailures()) {
            log.warn("{} of {} events failed to index into {}: {}",
                result.getFailed(), batch.size(), index, result.getFailureMessage());
        }
        batch.clear();
        if (!run.stamped && result.getSucceeded() > 0) {
            stampNewIndex(index, run);
        }
        log.debug("Progress: {} events indexed into {}", run.indexed, index);
    }

    /**
     * Mark an index this run created before more batches land in it.
     *
     * @throws IllegalStateException when the marker cannot be written
     */
    private void stampNewIndex(String index, IndexRun run) {
        int attempts = Math.max(markerRetryAttempts, 1);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (gate.stampVersion(run.caseId)) {
                run.stamped = true;
                return;
            }
            if (attempt < attempts && !pause()) {
                break;
            }
        }
        throw new IllegalStateException("Could not write the version marker on " + index);
    }

    private boolean pause() {
        try {
            Thread.sleep(markerRetryDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void runStages(DetectionStage.Phase phase, IndexedFile file, String index) {
        List<DetectionStage> stages = detectionStages.orderedStream()
            .filter(stage -> stage.phase() == phase)
            .collect(Collectors.toList());
        for (DetectionStage stage : stages) {
            try {
                DetectionResult result = stage.run(file, index);
                if (phase == DetectionStage.Phase.SIGMA) {
                    file.setSigmaEventCount(file.getSigmaEventCount() + result.getFlaggedEvents());
                    file.setViolationCount(file.getViolationCount() + result.getViolations());
                } else {
                    file.setIocEventCount(file.getIocEventCount() + result.getFlaggedEvents());
                }
                log.info("Detection stage {} flagged {} events in file {}",
                    stage.name(), result.getFlaggedEvents(), file.getId());
            } catch (RuntimeException e) {
                log.error("Detection stage {} failed on file {}, continuing", stage.name(), file.getId(), e);
            }
        }
    }

    /**
     * Move to {@code status}, carrying the fields already set on {@code next}.
     *
     * @return the row as written, or null when another actor changed it first
     */
    private IndexedFile advance(IndexedFile current, IndexedFile next, ProcessingStatus status) {
        next.setIndexingStatus(status.getValue());
        if (!repository.compareAndSet(current, next)) {
            log.warn("File {} changed while in {}, abandoning this run", current.getId(), current.getIndexingStatus());
            return null;
        }
        return next;
    }

    private IndexedFile finish(IndexedFile current, IndexedFile completed, Timer.Sample sample) {
        if (!repository.compareAndSet(current, completed)) {
            log.warn("File {} changed before it could be completed", current.getId());
            metrics.recordFileFailed(sample);
            return repository.findById(current.getId()).orElse(current);
        }
        metrics.recordFileCompleted(sample);
        log.info("File {} completed: {} events, {} SIGMA, {} IOC",
            completed.getId(), completed.getEventCount(), completed.getSigmaEventCount(), completed.getIocEventCount());
        return completed;
    }

    private void markFailed(IndexedFile current, String status) {
        IndexedFile failed = new IndexedFile(current);
        failed.setIndexingStatus(status);
        failed.setTaskId(null);
        if (!repository.compareAndSet(current, failed)) {
            log.warn("Could not mark file {} as '{}': row changed concurrently", current.getId(), status);
        }
    }

    private static IndexedFile completedCopy(IndexedFile current, long eventCount) {
        IndexedFile completed = new IndexedFile(current);
        completed.setIndexingStatus(ProcessingStatus.COMPLETED.getValue());
        completed.setEventCount(eventCount);
        completed.setIndexed(true);
        completed.setTaskId(null);
        return completed;
    }

    /**
     * Empty files and single-event JSON files (collection artifacts such as
     * CyLR metadata) are kept out of the default views.
     */
    static boolean shouldHide(IndexedFile file, long eventCount) {
        if (eventCount == 0) {
            return true;
        }
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename().toLowerCase(Locale.ROOT) : "";
        return eventCount == 1 && "JSON".equals(file.getFileType()) && !name.endsWith(".evtx");
    }

    /**
     * Key linking a file row to its documents: {@code case<id>_<name>} with
     * JSON-ish and EVTX extensions stripped.
     */
    static String indexKey(long caseId, String filename) {
        String clean = filename == null ? "" : filename
            .replace(".evtx", "")
            .replace(".ndjson", "")
            .replace(".jsonl", "")
            .replace(".json", "");
        return "case" + caseId + "_" + clean;
    }

    static String fileTypeLabel(String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".evtx")) {
            return "EVTX";
        }
        if (lower.endsWith(".ndjson") || lower.endsWith(".jsonl")) {
            return "NDJSON";
        }
        if (lower.endsWith(".json")) {
            return "JSON";
        }
        if (lower.endsWith(".csv")) {
            return "CSV";
        }
        return "UNKNOWN";
    }

    void setBulkSize(int bulkSize) {
        this.bulkSize = bulkSize;
    }

    void setMarkerRetry(int attempts, long delayMs) {
        this.markerRetryAttempts = Math.max(attempts, 1);
        this.markerRetryDelayMs = delayMs;
    }

    private static class IndexRun {
        final long caseId;
        boolean stamped;
        long parsed;
        long indexed;

        IndexRun(long caseId, boolean stamped) {
            this.caseId = caseId;
            this.stamped = stamped;
        }
    }
}

package com.casetrace.storage;

import com.casetrace.domain.IndexedFile;
import com.casetrace.domain.ProcessingStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link IndexedFileRepository} over the {@code indexed_file} table.
 */
@Repository
public class JdbcIndexedFileRepository implements IndexedFileRepository {
    private static final Logger logger = LoggerFactory.getLogger(JdbcIndexedFileRepository.class);

    private static final String COLUMNS = """
        id, case_id, original_filename, file_path, file_hash, file_type,
        indexing_status, event_count, violation_count, sigma_event_count, ioc_event_count,
        is_indexed, is_hidden, is_deleted, index_key, task_id, uploaded_at, updated_at
        """;

    private static final String UPDATE_GUARDED = """
        UPDATE indexed_file
           SET indexing_status = ?, event_count = ?, violation_count = ?,
               sigma_event_count = ?, ioc_event_count = ?,
               is_indexed = ?, is_hidden = ?, index_key = ?, task_id = ?, updated_at = ?
         WHERE id = ? AND indexing_status = ? AND\s""";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Autowired
    public JdbcIndexedFileRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Clock.systemUTC());
    }

    JdbcIndexedFileRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<IndexedFile> findById(long id) {
        List<IndexedFile> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM indexed_file WHERE id = ?",
            new IndexedFileRowMapper(), id);
        return rows.stream().findFirst();
    }

    @Override
    public List<IndexedFile> findActive(Long caseId) {
        if (caseId == null) {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM indexed_file WHERE is_deleted = FALSE ORDER BY case_id, id",
                new IndexedFileRowMapper());
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM indexed_file WHERE is_deleted = FALSE AND case_id = ? ORDER BY id",
            new IndexedFileRowMapper(), caseId);
    }

    @Override
    public List<IndexedFile> findActiveByStatus(String status) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM indexed_file WHERE is_deleted = FALSE AND indexing_status = ? ORDER BY id",
            new IndexedFileRowMapper(), status);
    }

    @Override
    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT indexing_status, COUNT(*) AS n FROM indexed_file WHERE is_deleted = FALSE GROUP BY indexing_status",
            (RowCallbackHandler) rs -> {
                counts.put(rs.getString("indexing_status"), rs.getLong("n"));
            });
        return counts;
    }

    @Override
    public boolean compareAndSet(IndexedFile expected, IndexedFile updated) {
        boolean completed = updated.hasStatus(ProcessingStatus.COMPLETED);
        String newTaskId = completed ? null : updated.getTaskId();

        List<Object> args = new ArrayList<>();
        args.add(updated.getIndexingStatus());
        args.add(updated.getEventCount());
        args.add(updated.getViolationCount());
        args.add(updated.getSigmaEventCount());
        args.add(updated.getIocEventCount());
        args.add(updated.isIndexed());
        args.add(updated.isHidden());
        args.add(updated.getIndexKey());
        args.add(newTaskId);
        args.add(Timestamp.from(Instant.now(clock)));
        args.add(expected.getId());
        args.add(expected.getIndexingStatus());

        String sql;
        if (expected.getTaskId() == null) {
            sql = UPDATE_GUARDED + "task_id IS NULL";
        } else {
            sql = UPDATE_GUARDED + "task_id = ?";
            args.add(expected.getTaskId());
        }

        int rows = jdbcTemplate.update(sql, args.toArray());
        if (rows == 0) {
            logger.debug("Guarded update of file {} lost: expected status={} task={}",
                expected.getId(), expected.getIndexingStatus(), expected.getTaskId());
            return false;
        }
        if (completed) {
            updated.setTaskId(null);
        }
        return true;
    }

    private static class IndexedFileRowMapper implements RowMapper<IndexedFile> {
        @Override
        public IndexedFile mapRow(ResultSet rs, int rowNum) throws SQLException {
            IndexedFile file = new IndexedFile();
            file.setId(rs.getLong("id"));
            file.setCaseId(rs.getLong("case_id"));
            file.setOriginalFilename(rs.getString("original_filename"));
            file.setFilePath(rs.getString("file_path"));
            file.setFileHash(rs.getString("file_hash"));
            file.setFileType(rs.getString("file_type"));
            file.setIndexingStatus(rs.getString("indexing_status"));
            file.setEventCount(rs.getLong("event_count"));
            file.setViolationCount(rs.getLong("violation_count"));
            file.setSigmaEventCount(rs.getLong("sigma_event_count"));
            file.setIocEventCount(rs.getLong("ioc_event_count"));
            file.setIndexed(rs.getBoolean("is_indexed"));
            file.setHidden(rs.getBoolean("is_hidden"));
            file.setDeleted(rs.getBoolean("is_deleted"));
            file.setIndexKey(rs.getString("index_key"));
            file.setTaskId(rs.getString("task_id"));
            file.setUploadedAt(toInstant(rs.getTimestamp("uploaded_at")));
            file.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
            return file;
        }

        private static Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}

package com.casetrace.storage.hot;

import com.casetrace.domain.EventHit;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.search.builder.SearchSourceBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Document-store operations used by ingestion, search and repair.
 *
 * Every call is bounded by the client timeouts. Failures are raised as
 * {@link SearchEngineException}.
 */
public interface SearchEngineClient extends IndexSettingStore {

    SearchPage search(String index, SearchSourceBuilder source);

    /**
     * Run the first request of a scroll. The returned page carries the cursor id.
     */
    SearchPage openScroll(String index, SearchSourceBuilder source, String keepAlive);

    SearchPage continueScroll(String scrollId, String keepAlive);

    /**
     * Release a server-side cursor.
     *
     * @return true when the engine confirmed the release
     */
    boolean clearScroll(String scrollId);

    /**
     * Index documents keyed by document id. Existing ids are overwritten.
     */
    BulkIndexResult bulkIndex(String index, Map<String, Map<String, Object>> documentsById);

    Optional<EventHit> getDocument(String index, String id);

    /**
     * @return false when the index did not exist
     */
    boolean deleteIndex(String index);

    /**
     * Set the given field values on every document matching the query.
     *
     * @return number of updated documents
     */
    long updateByQuery(String index, QueryBuilder query, Map<String, Object> fieldValues);
}

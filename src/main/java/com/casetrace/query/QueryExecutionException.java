package com.casetrace.query;

import com.casetrace.storage.hot.SearchEngineException;

/**
 * Search or export failure surfaced to the caller.
 * Carries the engine failure kind so a timeout can be retried while a
 * malformed query or a missing index cannot.
 */
public class QueryExecutionException extends RuntimeException {

    private final SearchEngineException.Kind kind;
    private final String index;
    private final String query;

    public QueryExecutionException(String message, SearchEngineException.Kind kind,
                                   String index, String query, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.index = index;
        this.query = query;
    }

    public static QueryExecutionException from(String message, String index, String query,
                                               SearchEngineException cause) {
        return new QueryExecutionException(message, cause.getKind(), index, query, cause);
    }

    public SearchEngineException.Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind != null && kind.isTransient();
    }

    public String getIndex() {
        return index;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (kind != null) {
            sb.append(" [Kind: ").append(kind).append("]");
        }
        if (index != null) {
            sb.append(" [Index: ").append(index).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}

package com.casetrace.storage.hot;

/**
 * Failure talking to the search engine, classified so callers can tell a
 * transient condition from a bad request.
 */
public class SearchEngineException extends RuntimeException {

    public enum Kind {
        /**
         * Request did not complete within the client timeout. Transient.
         */
        TIMEOUT,
        /**
         * Cluster unreachable or rejecting load. Transient.
         */
        UNAVAILABLE,
        MALFORMED_QUERY,
        INDEX_NOT_FOUND,
        UNKNOWN;

        public boolean isTransient() {
            return this == TIMEOUT || this == UNAVAILABLE;
        }
    }

    private final Kind kind;
    private final String index;

    public SearchEngineException(Kind kind, String index, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.index = index;
    }

    public Kind getKind() {
        return kind;
    }

    public String getIndex() {
        return index;
    }

    @Override
    public String getMessage() {
        return String.format("[%s] %s (index: %s)", kind, super.getMessage(), index);
    }
}

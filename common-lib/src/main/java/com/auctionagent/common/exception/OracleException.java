package com.auctionagent.common.exception;

/**
 * Failure while consulting the strategy oracle. Never escapes the oracle adapter: it is
 * converted into a failed {@code OracleResult} after retries.
 */
public class OracleException extends RuntimeException {

    public enum Kind {
        NOT_CONFIGURED,
        TRANSPORT,
        TIMEOUT,
        MALFORMED;

        /** Malformed output and missing configuration will not improve on retry. */
        public boolean retryable() {
            return this == TRANSPORT || this == TIMEOUT;
        }
    }

    private final Kind kind;

    public OracleException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public OracleException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}

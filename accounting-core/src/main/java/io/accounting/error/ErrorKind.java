package io.accounting.error;

/**
 * Failure categories shared by the store, its HTTP API and its clients.
 * The HTTP status is the one the API answers with for that kind.
 */
public enum ErrorKind {
    VALIDATION(400),
    CONFLICT(409),
    NOT_FOUND(404),
    INVALID_QUERY(400),
    UPSTREAM_UNAVAILABLE(503),
    PERSISTENCE(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) { this.httpStatus = httpStatus; }

    public int httpStatus() { return httpStatus; }
}

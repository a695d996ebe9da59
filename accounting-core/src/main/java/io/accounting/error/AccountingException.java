package io.accounting.error;

public abstract class AccountingException extends RuntimeException {
    protected AccountingException(String message) {
        super(message);
    }

    protected AccountingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /**
     * Rebuilds the typed exception for a kind reported by a remote store.
     */
    public static AccountingException of(ErrorKind kind, String message) {
        return switch (kind) {
            case VALIDATION -> new ValidationException(message);
            case CONFLICT -> new ConflictException(message);
            case NOT_FOUND -> new NotFoundException(message);
            case INVALID_QUERY -> new InvalidQueryException(message);
            case UPSTREAM_UNAVAILABLE -> new UpstreamUnavailableException(message);
            case PERSISTENCE -> new PersistenceException(message);
        };
    }
}

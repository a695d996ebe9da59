package io.accounting.error;

public class InvalidQueryException extends AccountingException {
    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() { return ErrorKind.INVALID_QUERY; }
}

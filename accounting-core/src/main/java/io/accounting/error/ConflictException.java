package io.accounting.error;

public class ConflictException extends AccountingException {
    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() { return ErrorKind.CONFLICT; }
}

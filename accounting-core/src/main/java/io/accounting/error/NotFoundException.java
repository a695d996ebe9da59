package io.accounting.error;

public class NotFoundException extends AccountingException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() { return ErrorKind.NOT_FOUND; }
}

package io.accounting.error;

public class PersistenceException extends AccountingException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() { return ErrorKind.PERSISTENCE; }
}

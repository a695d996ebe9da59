package io.accounting.error;

public class UpstreamUnavailableException extends AccountingException {
    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() { return ErrorKind.UPSTREAM_UNAVAILABLE; }
}

package io.accounting.core;

import io.accounting.error.ErrorKind;

/**
 * Result for one element of a bulk create. {@code errorKind} and {@code message} are only set
 * for rejected elements; {@code recordId} is null when the element could not be read at all.
 */
public record BulkOutcome(int index, String recordId, Status status, ErrorKind errorKind, String message) {
    public enum Status { CREATED, ALREADY_EXISTS, REJECTED }

    public static BulkOutcome created(int index, String recordId) {
        return new BulkOutcome(index, recordId, Status.CREATED, null, null);
    }

    public static BulkOutcome alreadyExists(int index, String recordId) {
        return new BulkOutcome(index, recordId, Status.ALREADY_EXISTS, null, null);
    }

    public static BulkOutcome rejected(int index, String recordId, ErrorKind kind, String message) {
        return new BulkOutcome(index, recordId, Status.REJECTED, kind, message);
    }
}

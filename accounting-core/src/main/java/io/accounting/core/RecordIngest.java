package io.accounting.core;

import java.time.Instant;
import java.util.List;

/**
 * Ingestion and lookup contract of the record store, served in-process by the JDBC store and
 * remotely by the HTTP client.
 *
 * <p>Failures surface as {@link io.accounting.error.AccountingException} subclasses:
 * {@code ConflictException} for a duplicate create in strict mode, {@code NotFoundException}
 * for unknown ids and {@code ValidationException} for records that break the model rules.
 */
public interface RecordIngest {
    CreateOutcome createOrOpen(Record record);

    CloseOutcome close(String recordId, Instant stopTime);

    Record get(String recordId);

    List<BulkOutcome> bulkCreate(List<Record> records);
}

package io.accounting.collector;

import io.accounting.core.BulkOutcome;
import io.accounting.core.CloseOutcome;
import io.accounting.core.CreateOutcome;
import io.accounting.core.Record;
import io.accounting.core.RecordIngest;
import io.accounting.error.ConflictException;
import io.accounting.error.NotFoundException;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Strict record store double that records calls and can fail the next ones on demand. */
public class InMemoryStore implements RecordIngest {
    public final Map<String, Record> records = new LinkedHashMap<>();
    public final List<String> calls = new ArrayList<>();
    private final Deque<RuntimeException> failures = new ArrayDeque<>();

    public synchronized void failNext(RuntimeException e) { failures.add(e); }

    @Override
    public synchronized CreateOutcome createOrOpen(Record record) {
        calls.add("create " + record.recordId());
        failIfScripted();
        if (records.containsKey(record.recordId())) throw new ConflictException(record.recordId() + " exists");
        records.put(record.recordId(), record);
        return CreateOutcome.CREATED;
    }

    @Override
    public synchronized CloseOutcome close(String recordId, Instant stopTime) {
        calls.add("close " + recordId);
        failIfScripted();
        Record r = records.get(recordId);
        if (r == null) throw new NotFoundException(recordId + " missing");
        if (r.stopTime().map(stopTime::equals).orElse(false)) return CloseOutcome.UNCHANGED;
        records.put(recordId, r.withStopTime(stopTime));
        return CloseOutcome.CLOSED;
    }

    @Override
    public synchronized Record get(String recordId) {
        Record r = records.get(recordId);
        if (r == null) throw new NotFoundException(recordId + " missing");
        return r;
    }

    @Override
    public synchronized List<BulkOutcome> bulkCreate(List<Record> batch) {
        List<BulkOutcome> out = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            Record r = batch.get(i);
            if (records.putIfAbsent(r.recordId(), r) == null) out.add(BulkOutcome.created(i, r.recordId()));
            else out.add(BulkOutcome.alreadyExists(i, r.recordId()));
        }
        return out;
    }

    private void failIfScripted() {
        RuntimeException e = failures.poll();
        if (e != null) throw e;
    }
}

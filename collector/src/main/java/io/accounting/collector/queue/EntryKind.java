package io.accounting.collector.queue;

public enum EntryKind {
    /** Create the record, open or already closed. */
    CREATE,
    /** Set the stop time of a record created open earlier. */
    CLOSE
}

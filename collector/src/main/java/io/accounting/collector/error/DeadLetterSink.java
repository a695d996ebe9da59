package io.accounting.collector.error;

import io.accounting.collector.queue.QueueEntry;
import io.accounting.collector.source.SourceJob;

/**
 * Final resting place of queue entries the store will never accept, and of jobs that could not
 * be turned into records at all.
 */
public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(String stage, QueueEntry entry, Exception e);
    void acceptJob(String stage, SourceJob job, Exception e);
    @Override default void close() {}
}

package io.accounting.collector.source;

import java.util.List;

public interface JobSource {
    /**
     * Jobs modified after {@code cursor}, ordered by modification time then job id.
     *
     * @throws io.accounting.error.UpstreamUnavailableException when the batch system cannot be asked
     */
    List<SourceJob> fetchAfter(Cursor cursor);
}

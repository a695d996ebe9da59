package io.accounting.collector.enrich;

import java.util.Map;

/**
 * Outcome of asking the metrics system for the missing components of one record.
 *
 * @param amounts component amounts found, by component name
 */
public record EnrichResult(Status status, Map<String, Long> amounts, String reason) {
    public enum Status {
        /** Every requested component was found. */
        COMPLETE,
        /** The metrics system answered but some components are not there yet. */
        INCOMPLETE,
        /** The metrics system could not be asked; does not count as an attempt. */
        UNAVAILABLE
    }

    public EnrichResult {
        amounts = amounts == null ? Map.of() : Map.copyOf(amounts);
    }

    public static EnrichResult complete(Map<String, Long> amounts) {
        return new EnrichResult(Status.COMPLETE, amounts, null);
    }

    public static EnrichResult incomplete(Map<String, Long> found, String reason) {
        return new EnrichResult(Status.INCOMPLETE, found, reason);
    }

    public static EnrichResult unavailable(String reason) {
        return new EnrichResult(Status.UNAVAILABLE, Map.of(), reason);
    }
}

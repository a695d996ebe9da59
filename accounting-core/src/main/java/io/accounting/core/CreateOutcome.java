package io.accounting.core;

public enum CreateOutcome {
    CREATED,
    /** Duplicate accepted as a no-op; only reported by a store running in lenient mode. */
    ALREADY_EXISTS
}

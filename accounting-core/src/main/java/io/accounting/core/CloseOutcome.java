package io.accounting.core;

public enum CloseOutcome {
    CLOSED,
    /** The record already carried the same stop time; nothing was written. */
    UNCHANGED
}

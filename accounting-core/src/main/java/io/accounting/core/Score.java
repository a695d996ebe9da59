package io.accounting.core;

import io.accounting.error.ValidationException;

/**
 * Normalization factor attached to a component, e.g. a benchmark value per core.
 */
public record Score(String name, double value) {
    public Score {
        Names.requireValid("score name", name);
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ValidationException("score " + name + " must be a finite, non-negative number, got " + value);
        }
    }
}

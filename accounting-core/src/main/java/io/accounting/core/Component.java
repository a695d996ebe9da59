package io.accounting.core;

import io.accounting.error.ValidationException;

import java.util.List;

public record Component(String name, long amount, List<Score> scores) {
    public Component {
        Names.requireValid("component name", name);
        if (amount < 0) {
            throw new ValidationException("component " + name + " has negative amount " + amount);
        }
        scores = scores == null ? List.of() : List.copyOf(scores);
    }

    public static Component of(String name, long amount, Score... scores) {
        return new Component(name, amount, List.of(scores));
    }
}

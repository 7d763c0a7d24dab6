package com.puzzlesolver.core.expr;

import java.util.Map;
import java.util.Objects;

/**
 * Named variable leaf whose value is looked up in the assignment at evaluation time.
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    @Override
    public int evaluate(Map<String, Integer> variables) {
        Integer value = variables.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No value assigned to variable " + name);
        }
        return value;
    }

    @Override
    public void collectVariables(Map<String, Integer> into, int defaultValue) {
        into.putIfAbsent(name, defaultValue);
    }

    @Override
    public String toString() {
        return name;
    }
}

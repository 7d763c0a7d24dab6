package com.puzzlesolver.core.expr;

import java.util.Map;

/**
 * Integer constant leaf.
 */
public record Literal(int value) implements Expression {

    @Override
    public int evaluate(Map<String, Integer> variables) {
        return value;
    }

    @Override
    public void collectVariables(Map<String, Integer> into, int defaultValue) {
        // no variables
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}

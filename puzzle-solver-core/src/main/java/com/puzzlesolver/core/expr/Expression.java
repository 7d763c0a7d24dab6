package com.puzzlesolver.core.expr;

import java.util.Map;

/**
 * Immutable algebraic expression tree whose leaves are integer literals or named variables.
 */
public interface Expression {

    /**
     * Evaluates this expression under the provided variable assignment.
     *
     * @param variables value of every variable appearing in this expression
     * @return the integer value of the expression
     * @throws IllegalArgumentException if a variable has no value in {@code variables}
     * @throws ArithmeticException if a division by zero occurs
     */
    int evaluate(Map<String, Integer> variables);

    /**
     * Adds one entry per distinct variable name found in this expression, in left-to-right order.
     * Names already present in {@code into} keep their current value.
     */
    void collectVariables(Map<String, Integer> into, int defaultValue);

    /**
     * Returns a tree equal to this one that shares no mutable storage with it. Expression trees
     * are immutable, so implementations may return {@code this}.
     */
    default Expression copy() {
        return this;
    }
}

package com.puzzlesolver.core.expr;

/**
 * Binary arithmetic operators. An {@link Operation} with more than two operands folds them from
 * left to right.
 */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Applies this operator to two operands. Division rounds towards negative infinity.
     *
     * @throws ArithmeticException if dividing by zero or if the result overflows an {@code int}
     */
    public int apply(int left, int right) {
        switch (this) {
            case ADD:
                return Math.addExact(left, right);
            case SUBTRACT:
                return Math.subtractExact(left, right);
            case MULTIPLY:
                return Math.multiplyExact(left, right);
            case DIVIDE:
                if (right == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                return Math.floorDiv(left, right);
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }

    /**
     * Returns the operator rendered as {@code symbol}.
     *
     * @throws IllegalArgumentException if no operator uses that symbol
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator operator : values()) {
            if (operator.symbol == symbol) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator symbol '" + symbol + "'");
    }
}

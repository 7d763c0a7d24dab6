package com.puzzlesolver.core.expr;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Interior node applying one {@link Operator} to two or more operands.
 */
public record Operation(Operator operator, List<Expression> operands) implements Expression {

    public Operation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operands, "operands");
        if (operands.size() < 2) {
            throw new IllegalArgumentException("Operation needs at least two operands");
        }
        operands = List.copyOf(operands);
    }

    public static Operation of(Operator operator, Expression... operands) {
        return new Operation(operator, List.of(operands));
    }

    @Override
    public int evaluate(Map<String, Integer> variables) {
        int result = operands.get(0).evaluate(variables);
        for (int i = 1; i < operands.size(); i++) {
            result = operator.apply(result, operands.get(i).evaluate(variables));
        }
        return result;
    }

    @Override
    public void collectVariables(Map<String, Integer> into, int defaultValue) {
        for (Expression operand : operands) {
            operand.collectVariables(into, defaultValue);
        }
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(" " + operator.symbol() + " ", "(", ")"));
    }
}

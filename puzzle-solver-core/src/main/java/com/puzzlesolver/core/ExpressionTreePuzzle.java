package com.puzzlesolver.core;

import com.puzzlesolver.core.expr.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Puzzle that assigns single digits to the variables of an {@link Expression} so that the
 * expression evaluates to a target value.
 *
 * <p>Every variable holds a value between 0 and 9, where 0 means "unassigned". The puzzle is
 * solved once all variables are assigned and the expression evaluates to the target. Instances
 * are immutable; {@link #withVariable(String, int)} and {@link #extensions()} return new states.
 */
public final class ExpressionTreePuzzle extends Puzzle<ExpressionTreePuzzle> {

    public static final int UNASSIGNED = 0;
    public static final int MIN_DIGIT = 1;
    public static final int MAX_DIGIT = 9;

    private final Expression expression;
    private final LinkedHashMap<String, Integer> variables;
    private final int target;
    private String canonical;

    /**
     * Creates the initial state with every variable of {@code expression} unassigned.
     */
    public ExpressionTreePuzzle(Expression expression, int target) {
        Objects.requireNonNull(expression, "expression");
        LinkedHashMap<String, Integer> lookup = new LinkedHashMap<>();
        expression.collectVariables(lookup, UNASSIGNED);
        this.expression = expression;
        this.variables = lookup;
        this.target = target;
    }

    private ExpressionTreePuzzle(Expression expression, LinkedHashMap<String, Integer> variables, int target) {
        this.expression = expression;
        this.variables = variables;
        this.target = target;
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * Returns a read-only view of the variable assignment in first-appearance order.
     */
    public Map<String, Integer> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public int getTarget() {
        return target;
    }

    /**
     * Returns a copy of this state with {@code name} set to {@code value}.
     *
     * @throws IllegalArgumentException if the variable does not occur in the expression or the
     *         value is not a digit
     */
    public ExpressionTreePuzzle withVariable(String name, int value) {
        Objects.requireNonNull(name, "name");
        if (!variables.containsKey(name)) {
            throw new IllegalArgumentException("Unknown variable " + name);
        }
        if (value < UNASSIGNED || value > MAX_DIGIT) {
            throw new IllegalArgumentException("Variable value must be between 0 and 9: " + value);
        }
        ExpressionTreePuzzle copy = copy();
        copy.variables.put(name, value);
        return copy;
    }

    @Override
    public boolean isSolved() {
        boolean assigned = true;
        for (int value : variables.values()) {
            if (value == UNASSIGNED) {
                assigned = false;
                break;
            }
        }
        return assigned && expression.evaluate(variables) == target;
    }

    @Override
    public List<ExpressionTreePuzzle> extensions() {
        List<ExpressionTreePuzzle> children = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : variables.entrySet()) {
            if (entry.getValue() != UNASSIGNED) {
                continue;
            }
            for (int digit = MIN_DIGIT; digit <= MAX_DIGIT; digit++) {
                ExpressionTreePuzzle child = copy();
                child.variables.put(entry.getKey(), digit);
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Assumes that assigning a variable never lowers the value of the expression, which holds
     * for sums and products of non-negative operands only.
     */
    @Override
    public boolean failFast() {
        if (target <= 0) {
            return true;
        }
        return expression.evaluate(variables) > target;
    }

    @Override
    public String toString() {
        // children are filled in before they escape, so the rendering never goes stale
        if (canonical == null) {
            canonical = variables + "\n" + expression + " = " + target;
        }
        return canonical;
    }

    private ExpressionTreePuzzle copy() {
        return new ExpressionTreePuzzle(expression.copy(), new LinkedHashMap<>(variables), target);
    }
}

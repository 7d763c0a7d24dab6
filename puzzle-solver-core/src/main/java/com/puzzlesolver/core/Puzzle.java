package com.puzzlesolver.core;

import java.util.List;

/**
 * Full-information puzzle state explored by the solvers in {@code com.puzzlesolver.core.solver}.
 *
 * <p>{@link #toString()} is the canonical rendering of the state and doubles as its identity:
 * two states are equal exactly when their renderings are equal. Implementations must render
 * semantically identical states identically and must not let distinct states collide.
 *
 * @param <P> the concrete puzzle type
 */
public abstract class Puzzle<P extends Puzzle<P>> {

    /**
     * Returns {@code true} if this state satisfies every completion condition of the puzzle.
     */
    public abstract boolean isSolved();

    /**
     * Returns all legal one-step successors of this state. Each successor is an independent
     * instance sharing no mutable storage with this state or with its siblings.
     */
    public abstract List<P> extensions();

    /**
     * Returns {@code true} if this state can be cheaply proven to have no solution. A result of
     * {@code false} does not imply that a solution exists.
     */
    public boolean failFast() {
        return false;
    }

    /**
     * Returns the canonical rendering of this state.
     */
    @Override
    public abstract String toString();

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Puzzle<?>)) {
            return false;
        }
        return toString().equals(other.toString());
    }

    @Override
    public final int hashCode() {
        return toString().hashCode();
    }
}

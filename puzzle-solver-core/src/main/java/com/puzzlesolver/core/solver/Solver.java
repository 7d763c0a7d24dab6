package com.puzzlesolver.core.solver;

import com.puzzlesolver.core.Puzzle;
import java.util.List;
import java.util.Set;

/**
 * Generic interface for exhaustive puzzle search strategies.
 */
public interface Solver {

    /**
     * Searches for a sequence of states leading from {@code puzzle} to a solved state.
     *
     * <p>The first element of the returned list is {@code puzzle}, every following element is one of
     * the {@link Puzzle#extensions()} of its predecessor and the last element is solved. An empty
     * list means that no solution is reachable.
     *
     * @param puzzle the initial state
     * @param seen canonical renderings of states that must not appear on the path; never modified
     * @return an unmodifiable path to a solution, or an empty list
     */
    <P extends Puzzle<P>> List<P> solve(P puzzle, Set<String> seen);

    /**
     * Searches without excluding any state up front.
     */
    default <P extends Puzzle<P>> List<P> solve(P puzzle) {
        return solve(puzzle, Set.of());
    }

    /**
     * Returns counters describing the most recent {@code solve} call.
     */
    SearchStatistics getLastStatistics();
}

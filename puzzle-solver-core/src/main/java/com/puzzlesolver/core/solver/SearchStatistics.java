package com.puzzlesolver.core.solver;

/**
 * Counters captured during a single {@link Solver#solve} call.
 *
 * @param expandedStates states whose extensions were generated
 * @param generatedStates extensions produced across all expanded states
 * @param pathLength number of states in the returned path, 0 when unsolved
 * @param elapsedNanos wall-clock duration of the search
 */
public record SearchStatistics(long expandedStates, long generatedStates, int pathLength, long elapsedNanos) {

    private static final SearchStatistics EMPTY = new SearchStatistics(0L, 0L, 0, 0L);

    public SearchStatistics {
        if (expandedStates < 0L || generatedStates < 0L || pathLength < 0 || elapsedNanos < 0L) {
            throw new IllegalArgumentException("Statistics must be non-negative");
        }
    }

    public static SearchStatistics empty() {
        return EMPTY;
    }

    public boolean solved() {
        return pathLength > 0;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}

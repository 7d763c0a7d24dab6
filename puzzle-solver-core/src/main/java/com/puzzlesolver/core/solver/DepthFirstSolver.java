package com.puzzlesolver.core.solver;

import com.puzzlesolver.core.Puzzle;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recursive backtracking solver. Returns the first solution found along the extension order,
 * which is not necessarily the shortest one.
 *
 * <p>A state is marked as seen while its subtree is explored. Once a child has been attempted it
 * stays marked for its remaining siblings, while markings made inside the child's own subtree are
 * rolled back when the recursion returns.
 */
public final class DepthFirstSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(DepthFirstSolver.class.getName());

    private SearchStatistics lastStatistics = SearchStatistics.empty();
    private long expandedStates;
    private long generatedStates;

    @Override
    public <P extends Puzzle<P>> List<P> solve(P puzzle, Set<String> seen) {
        Objects.requireNonNull(puzzle, "puzzle");
        Objects.requireNonNull(seen, "seen");

        long start = System.nanoTime();
        expandedStates = 0L;
        generatedStates = 0L;

        Deque<P> path = new ArrayDeque<>();
        if (puzzle.isSolved()) {
            path.add(puzzle);
        } else if (!puzzle.failFast()) {
            search(puzzle, new HashSet<>(seen), path);
        }

        List<P> result = List.copyOf(path);
        lastStatistics = new SearchStatistics(expandedStates, generatedStates, result.size(),
                System.nanoTime() - start);
        LOGGER.fine(() -> String.format("Depth-first search %s after expanding %d states (path length %d, %.2f ms)",
                result.isEmpty() ? "failed" : "succeeded", lastStatistics.expandedStates(),
                lastStatistics.pathLength(), lastStatistics.elapsedMillis()));
        return result;
    }

    @Override
    public SearchStatistics getLastStatistics() {
        return lastStatistics;
    }

    private <P extends Puzzle<P>> boolean search(P puzzle, Set<String> seen, Deque<P> path) {
        if (puzzle.isSolved()) {
            path.addFirst(puzzle);
            return true;
        }

        List<String> marked = new ArrayList<>();
        try {
            mark(seen, puzzle.toString(), marked);
            expandedStates++;
            List<P> extensions = puzzle.extensions();
            generatedStates += extensions.size();
            for (P extension : extensions) {
                String key = extension.toString();
                if (!seen.contains(key) && !extension.failFast() && search(extension, seen, path)) {
                    path.addFirst(puzzle);
                    return true;
                }
                mark(seen, key, marked);
            }
            return false;
        } finally {
            for (String key : marked) {
                seen.remove(key);
            }
        }
    }

    private static void mark(Set<String> seen, String key, List<String> marked) {
        if (seen.add(key)) {
            marked.add(key);
        }
    }
}

package com.puzzlesolver.core.solver;

import com.puzzlesolver.core.Puzzle;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Level-order solver that returns a path with the fewest extension steps.
 *
 * <p>States are recorded as discovered the moment they are enqueued, so every distinct state
 * enters the queue at most once. Paths are rebuilt from parent back-pointers keyed by canonical
 * rendering.
 */
public final class BreadthFirstSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSolver.class.getName());

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

        List<P> result = search(puzzle, seen);
        lastStatistics = new SearchStatistics(expandedStates, generatedStates, result.size(),
                System.nanoTime() - start);
        LOGGER.fine(() -> String.format("Breadth-first search %s after expanding %d states (path length %d, %.2f ms)",
                result.isEmpty() ? "failed" : "succeeded", lastStatistics.expandedStates(),
                lastStatistics.pathLength(), lastStatistics.elapsedMillis()));
        return result;
    }

    @Override
    public SearchStatistics getLastStatistics() {
        return lastStatistics;
    }

    private <P extends Puzzle<P>> List<P> search(P root, Set<String> seen) {
        if (root.isSolved()) {
            return List.of(root);
        }

        Set<String> discovered = new HashSet<>(seen);
        String rootKey = root.toString();
        if (!discovered.add(rootKey)) {
            return List.of();
        }

        Queue<P> queue = new ArrayDeque<>();
        queue.add(root);
        Map<String, P> parents = new HashMap<>();
        while (!queue.isEmpty()) {
            P current = queue.remove();
            if (current.failFast()) {
                continue;
            }
            List<P> path = expand(current, queue, parents, discovered, rootKey);
            if (path != null) {
                return path;
            }
        }
        return List.of();
    }

    /**
     * Enqueues the undiscovered extensions of {@code current}; returns the path to the first solved
     * extension, or {@code null} if none of them is solved.
     */
    private <P extends Puzzle<P>> List<P> expand(P current, Queue<P> queue, Map<String, P> parents,
            Set<String> discovered, String rootKey) {
        expandedStates++;
        List<P> extensions = current.extensions();
        generatedStates += extensions.size();
        for (P extension : extensions) {
            String key = extension.toString();
            if (!discovered.add(key)) {
                continue;
            }
            parents.put(key, current);
            queue.add(extension);
            if (extension.isSolved()) {
                return reconstructPath(extension, rootKey, parents);
            }
        }
        return null;
    }

    private static <P extends Puzzle<P>> List<P> reconstructPath(P solved, String rootKey, Map<String, P> parents) {
        List<P> path = new ArrayList<>();
        P state = solved;
        path.add(state);
        while (!state.toString().equals(rootKey)) {
            state = parents.get(state.toString());
            path.add(state);
        }
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }
}

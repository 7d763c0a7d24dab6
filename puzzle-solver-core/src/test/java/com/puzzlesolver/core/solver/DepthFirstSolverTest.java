package com.puzzlesolver.core.solver;

import static com.puzzlesolver.core.solver.PathAssertions.assertValidPath;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.puzzlesolver.core.ExpressionTreePuzzle;
import com.puzzlesolver.core.expr.ExpressionParser;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DepthFirstSolverTest {

    private static final Map<String, List<String>> UNBALANCED = Map.of(
            "S", List.of("A", "B"),
            "A", List.of("C"),
            "C", List.of("G"),
            "B", List.of("G"));

    @Test
    void solvesSingleVariablePuzzle() {
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("a"), 4);

        List<ExpressionTreePuzzle> path = new DepthFirstSolver().solve(puzzle);

        assertValidPath(puzzle, path);
        assertEquals(2, path.size());
        assertEquals(Map.of("a", 4), path.get(1).getVariables());
    }

    @Test
    void solvesNestedExpression() {
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("(a * (b + 6 + 6)) + 5"), 61);

        List<ExpressionTreePuzzle> path = new DepthFirstSolver().solve(puzzle);

        assertValidPath(puzzle, path);
        assertEquals(Map.of("a", 4, "b", 2), path.get(path.size() - 1).getVariables());
    }

    @Test
    void returnsRootWhenAlreadySolved() {
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("3 + 4"), 7);

        List<ExpressionTreePuzzle> path = new DepthFirstSolver().solve(puzzle);

        assertEquals(List.of(puzzle), path);
    }

    @Test
    void returnsEmptyPathWhenUnsolvable() {
        DepthFirstSolver solver = new DepthFirstSolver();

        assertTrue(solver.solve(new ExpressionTreePuzzle(ExpressionParser.parse("a * b"), 100)).isEmpty());
        assertTrue(solver.solve(new ExpressionTreePuzzle(ExpressionParser.parse("a + b"), 1)).isEmpty());
        assertTrue(solver.getLastStatistics().expandedStates() > 0);
        assertEquals(0, solver.getLastStatistics().pathLength());
    }

    @Test
    void nonPositiveTargetIsRejectedWithoutExpansion() {
        DepthFirstSolver solver = new DepthFirstSolver();
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("a + b"), 0);

        assertTrue(solver.solve(puzzle).isEmpty());
        assertEquals(0L, solver.getLastStatistics().expandedStates());
        assertEquals(0L, solver.getLastStatistics().generatedStates());
    }

    @Test
    void followsExtensionOrderRatherThanShortestPath() {
        GraphPuzzle start = new GraphPuzzle(UNBALANCED, "S", "G");

        List<GraphPuzzle> path = new DepthFirstSolver().solve(start);

        assertValidPath(start, path);
        assertEquals(List.of("S", "A", "C", "G"), nodes(path));
    }

    @Test
    void terminatesOnCycles() {
        Map<String, List<String>> cycle = Map.of(
                "S", List.of("A"),
                "A", List.of("B", "S"),
                "B", List.of("A", "S"));

        assertTrue(new DepthFirstSolver().solve(new GraphPuzzle(cycle, "S", "G")).isEmpty());
    }

    @Test
    void findsGoalBehindCycle() {
        Map<String, List<String>> cycle = Map.of(
                "S", List.of("A"),
                "A", List.of("S", "B"),
                "B", List.of("A", "G"));
        GraphPuzzle start = new GraphPuzzle(cycle, "S", "G");

        List<GraphPuzzle> path = new DepthFirstSolver().solve(start);

        assertEquals(List.of("S", "A", "B", "G"), nodes(path));
    }

    @Test
    void avoidsSeenStates() {
        GraphPuzzle start = new GraphPuzzle(UNBALANCED, "S", "G");
        Set<String> seen = new HashSet<>(Set.of("A"));

        List<GraphPuzzle> path = new DepthFirstSolver().solve(start, seen);

        assertEquals(List.of("S", "B", "G"), nodes(path));
        assertEquals(Set.of("A"), seen, "Caller's seen set must not be modified");
    }

    @Test
    void skipsFailFastStates() {
        GraphPuzzle start = new GraphPuzzle(UNBALANCED, Set.of("C"), "S", "G");

        List<GraphPuzzle> path = new DepthFirstSolver().solve(start);

        assertEquals(List.of("S", "B", "G"), nodes(path));
    }

    @Test
    void rollsBackMarkingsOfFailedSubtrees() {
        Map<String, List<String>> diamond = Map.of(
                "S", List.of("A", "B"),
                "A", List.of("C"),
                "B", List.of("C"),
                "C", List.of("D"));
        DepthFirstSolver solver = new DepthFirstSolver();

        assertTrue(solver.solve(new GraphPuzzle(diamond, "S", "G")).isEmpty());
        assertEquals(7L, solver.getLastStatistics().expandedStates(),
                "C and D are explored again under B once the subtree of A is abandoned");
    }

    @Test
    void overflowingExpressionIsNotReportedAsSolved() {
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("a + 2147483647 * 2"), 3);

        assertThrows(ArithmeticException.class, () -> new DepthFirstSolver().solve(puzzle));
    }

    @Test
    void countsEveryGeneratedExtension() {
        DepthFirstSolver solver = new DepthFirstSolver();

        solver.solve(new ExpressionTreePuzzle(ExpressionParser.parse("a"), 4));

        assertTrue(solver.getLastStatistics().solved());
        assertEquals(2, solver.getLastStatistics().pathLength());
        assertEquals(9L, solver.getLastStatistics().generatedStates());
    }

    @Test
    void rejectsNullArguments() {
        DepthFirstSolver solver = new DepthFirstSolver();
        ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(ExpressionParser.parse("a"), 1);
        ExpressionTreePuzzle missing = null;

        assertThrows(NullPointerException.class, () -> solver.solve(missing));
        assertThrows(NullPointerException.class, () -> solver.solve(puzzle, null));
    }

    private static List<String> nodes(List<GraphPuzzle> path) {
        return path.stream().map(GraphPuzzle::node).collect(Collectors.toList());
    }
}

package com.puzzlesolver.core;

import com.puzzlesolver.core.expr.Expression;
import com.puzzlesolver.core.expr.ExpressionParser;
import com.puzzlesolver.core.solver.SearchStatistics;
import com.puzzlesolver.core.solver.Solver;
import com.puzzlesolver.core.solver.SolverType;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command line entry point that solves an {@link ExpressionTreePuzzle} and prints the path of
 * states leading to the solution.
 */
public final class PuzzleSolverCLI {

    private static final Logger LOGGER = Logger.getLogger(PuzzleSolverCLI.class.getName());

    static final int INVALID_ARGUMENTS = -1;
    static final int EVALUATION_FAILED = -2;

    private PuzzleSolverCLI() {
    }

    public static void main(String[] args) {
        if (run(args, System.out) == INVALID_ARGUMENTS) {
            printUsage();
        }
    }

    /**
     * Parses the arguments, runs the requested solver and prints the outcome to {@code out}.
     *
     * @return the number of states on the solution path, 0 if unsolvable,
     *         {@link #INVALID_ARGUMENTS} or {@link #EVALUATION_FAILED} on failure
     */
    static int run(String[] args, PrintStream out) {
        if (args.length < 2 || args.length > 4) {
            return INVALID_ARGUMENTS;
        }
        try {
            Expression expression = ExpressionParser.parse(args[0]);
            int target = Integer.parseInt(args[1].trim());
            SolverType solverType = SolverType.DFS;
            boolean quiet = false;

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--solver=")) {
                    solverType = SolverType.fromShortName(option.substring("--solver=".length()));
                } else if ("--quiet".equals(option)) {
                    quiet = true;
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            ExpressionTreePuzzle puzzle = new ExpressionTreePuzzle(expression, target);
            Solver solver = solverType.create();
            List<ExpressionTreePuzzle> path = solver.solve(puzzle);
            printResult(out, path, solver.getLastStatistics(), quiet);
            return path.size();
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            return INVALID_ARGUMENTS;
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            return INVALID_ARGUMENTS;
        } catch (ArithmeticException ex) {
            LOGGER.log(Level.SEVERE, "Failed to evaluate expression", ex);
            out.printf("Evaluation failed: %s%n", ex.getMessage());
            return EVALUATION_FAILED;
        }
    }

    private static void printResult(PrintStream out, List<ExpressionTreePuzzle> path,
            SearchStatistics statistics, boolean quiet) {
        if (!statistics.solved()) {
            out.println("No solution.");
        } else {
            if (!quiet) {
                for (int step = 0; step < path.size(); step++) {
                    out.printf("Step %d:%n%s%n%n", step, path.get(step));
                }
            }
            out.printf("Solution: %s%n", path.get(path.size() - 1).getVariables());
        }
        out.printf("Expanded %d states, generated %d, in %.2f ms%n", statistics.expandedStates(),
                statistics.generatedStates(), statistics.elapsedMillis());
    }

    private static void printUsage() {
        String solvers = Arrays.stream(SolverType.values())
                .map(SolverType::shortName)
                .collect(Collectors.joining("|"));
        System.err.println("Usage: PuzzleSolverCLI <expression> <target> [--solver=" + solvers + "] [--quiet]");
    }
}

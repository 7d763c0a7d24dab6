package com.puzzlesolver.core.solver;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Available search strategies, addressable by their short command line name.
 */
public enum SolverType {
    DFS("dfs", DepthFirstSolver::new),
    BFS("bfs", BreadthFirstSolver::new);

    private final String shortName;
    private final Supplier<Solver> factory;

    SolverType(String shortName, Supplier<Solver> factory) {
        this.shortName = shortName;
        this.factory = factory;
    }

    public String shortName() {
        return shortName;
    }

    public Solver create() {
        return factory.get();
    }

    public static SolverType fromShortName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SolverType type : values()) {
            if (type.shortName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown solver: " + name);
    }
}

package com.factory.planner.engine;

public enum SolveFailure {
    INFEASIBLE("Infeasible"),
    UNBOUNDED("Unbounded"),
    NOT_SOLVED("Solver did not finish"),
    SOLVER_UNAVAILABLE("Solver unavailable");

    private final String label;

    SolveFailure(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

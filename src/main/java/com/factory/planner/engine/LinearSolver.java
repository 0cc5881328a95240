package com.factory.planner.engine;

public interface LinearSolver {
    LinearSolution solve(LinearProgram program) throws SolveException;
}

package com.factory.planner.engine;

import com.factory.planner.config.PlannerProperties;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link LinearSolver} backed by Google OR-Tools' {@link MPSolver}.
 *
 * <p>GLOP folds "infeasible or unbounded" into a single status, so an INFEASIBLE or
 * UNBOUNDED outcome is re-checked with the objective cleared: if the constraints alone are
 * satisfiable the problem was unbounded, otherwise it was infeasible. Only OPTIMAL
 * assignments are returned; time limits, FEASIBLE stops and solver errors surface as
 * {@link SolveFailure#NOT_SOLVED}.</p>
 */
@Slf4j
@Component
public class GoogleOrToolsSolver implements LinearSolver {

    static {
        Loader.loadNativeLibraries();
    }

    private final String solverId;
    private final long timeLimitMs;

    @Autowired
    public GoogleOrToolsSolver(PlannerProperties properties) {
        this(properties.getSolverId(), properties.getTimeLimitMs());
    }

    public GoogleOrToolsSolver(String solverId, long timeLimitMs) {
        this.solverId = solverId;
        this.timeLimitMs = timeLimitMs;
    }

    @Override
    public LinearSolution solve(LinearProgram program) throws SolveException {
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            log.error("Could not create solver {}", solverId);
            throw new SolveException(SolveFailure.SOLVER_UNAVAILABLE);
        }

        try {
            solver.setTimeLimit(timeLimitMs);

            // 1. Variables
            List<LinearProgram.Variable> variables = program.getVariables();
            MPVariable[] x = new MPVariable[variables.size()];
            for (int i = 0; i < x.length; i++) {
                LinearProgram.Variable variable = variables.get(i);
                x[i] = solver.makeNumVar(bound(variable.getLowerBound()), bound(variable.getUpperBound()),
                        variable.getName());
            }

            // 2. Constraints
            for (LinearProgram.LinearConstraint constraint : program.getConstraints()) {
                double rhs = constraint.getRhs();
                MPConstraint c = switch (constraint.getComparison()) {
                    case LESS_OR_EQUAL -> solver.makeConstraint(-MPSolver.infinity(), rhs, constraint.getName());
                    case EQUAL -> solver.makeConstraint(rhs, rhs, constraint.getName());
                    case GREATER_OR_EQUAL -> solver.makeConstraint(rhs, MPSolver.infinity(), constraint.getName());
                };
                for (LinearProgram.Term term : constraint.getTerms()) {
                    MPVariable var = x[term.getVariable()];
                    c.setCoefficient(var, c.getCoefficient(var) + term.getCoefficient());
                }
            }

            // 3. Objective
            MPObjective objective = solver.objective();
            for (int i = 0; i < x.length; i++) {
                double coefficient = variables.get(i).getObjectiveCoefficient();
                if (coefficient != 0.0) {
                    objective.setCoefficient(x[i], coefficient);
                }
            }
            objective.setMaximization();

            log.debug("Solving LP with {} variables and {} constraints using {}",
                    solver.numVariables(), solver.numConstraints(), solverId);

            final MPSolver.ResultStatus status = solver.solve();
            log.debug("Solver status: {}", status);

            if (status == MPSolver.ResultStatus.OPTIMAL) {
                double[] values = new double[x.length];
                for (int i = 0; i < x.length; i++) {
                    values[i] = x[i].solutionValue();
                }
                return new LinearSolution(values, objective.value());
            }

            SolveFailure failure = failureFor(status);
            if (failure == null) {
                failure = classifyFailure(solver, objective);
            }
            log.warn("LP solve failed with status {}, classified as {}", status, failure.getLabel());
            throw new SolveException(failure);
        } finally {
            solver.delete();
        }
    }

    /**
     * Failure for a non-optimal status, or null when the status only says
     * "infeasible or unbounded" and needs the feasibility re-check.
     * FEASIBLE means the solver stopped before proving optimality.
     */
    static SolveFailure failureFor(MPSolver.ResultStatus status) {
        return switch (status) {
            case INFEASIBLE, UNBOUNDED -> null;
            case OPTIMAL -> throw new IllegalArgumentException("OPTIMAL is not a failure");
            default -> SolveFailure.NOT_SOLVED;
        };
    }

    private SolveFailure classifyFailure(MPSolver solver, MPObjective objective) {
        objective.clear();
        MPSolver.ResultStatus recheck = solver.solve();
        log.debug("Feasibility re-check status: {}", recheck);
        return switch (recheck) {
            case OPTIMAL, FEASIBLE -> SolveFailure.UNBOUNDED;
            case INFEASIBLE -> SolveFailure.INFEASIBLE;
            default -> SolveFailure.NOT_SOLVED;
        };
    }

    private static double bound(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return value;
    }
}

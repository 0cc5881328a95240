package com.factory.planner.engine;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Factory;
import com.factory.planner.domain.FactoryEntry;
import com.factory.planner.domain.Problem;
import com.factory.planner.domain.RecipeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Solves a {@link Problem} against a {@link Catalog}: formulate, delegate to the
 * {@link LinearSolver}, then read recipe throughputs back into a {@link Factory}.
 *
 * <p>Stateless; one instance may serve concurrent solves over a shared catalog.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductionPlanner {

    /** Throughputs are rounded to 6 decimal places. */
    public static final double SOLUTION_ROUND_PRECISION = 1_000_000.0;

    private static final double EPSILON = Math.ulp(1.0);

    private final LinearSolver solver;
    private final ProblemFormulator formulator;

    public Factory solve(Catalog catalog, Problem problem) throws SolveException {
        long startTime = System.currentTimeMillis();

        Formulation formulation = formulator.formulate(catalog, problem);
        LinearSolution solution = solver.solve(formulation.getProgram());

        Factory.FactoryBuilder factory = Factory.builder();
        int active = 0;
        for (RecipeId recipe : catalog.recipeIds()) {
            double rate = roundSolution(solution.value(formulation.column(recipe)));
            if (Math.abs(rate) < EPSILON) {
                continue;
            }
            factory.recipe(FactoryEntry.of(recipe, rate));
            active++;
        }

        log.info("Solved plan with {} rules and {} objective terms: {} active recipes in {} ms",
                problem.getRules().size(), problem.getOptimizations().size(), active,
                System.currentTimeMillis() - startTime);
        return factory.build();
    }

    /**
     * Rounds to the nearest multiple of 1e-6, halves away from zero.
     */
    static double roundSolution(double value) {
        // floor stays in double range; Math.round would saturate at Long.MAX_VALUE
        return Math.signum(value) * Math.floor(Math.abs(value) * SOLUTION_ROUND_PRECISION + 0.5)
                / SOLUTION_ROUND_PRECISION;
    }
}

package com.factory.planner.engine;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Constraint;
import com.factory.planner.domain.Optimization;
import com.factory.planner.domain.Problem;
import com.factory.planner.domain.Recipe;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.Rule;
import com.factory.planner.domain.VariableId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a {@link Catalog} and a {@link Problem} into a {@link LinearProgram}.
 *
 * <p>Columns: one free net-flow variable per resource, then one throughput variable per
 * recipe bounded below by 0. Constraints are emitted in a fixed order so that solver
 * tie-breaking is reproducible:</p>
 * <ol>
 *   <li>conservation: {@code sum(rate * recipe) - resource = 0} for every resource</li>
 *   <li>non-negativity: {@code recipe >= 0} for every recipe</li>
 *   <li>user rules, in input order</li>
 *   <li>default balance: {@code resource = 0} for every resource no rule mentions</li>
 * </ol>
 */
@Component
public class ProblemFormulator {

    public Formulation formulate(Catalog catalog, Problem problem) {
        LinearProgram program = new LinearProgram();

        // 1. Objective coefficients, later entries for the same variable win
        double[] resourceCoefficients = new double[catalog.resourceCount()];
        double[] recipeCoefficients = new double[catalog.recipeCount()];

        for (Optimization optimization : problem.getOptimizations()) {
            VariableId variable = checked(catalog, optimization.getVariable());
            double[] coefficients = switch (variable.getKind()) {
                case RESOURCE -> resourceCoefficients;
                case RECIPE -> recipeCoefficients;
            };
            coefficients[variable.getIndex()] = optimization.getCoefficient();
        }

        // 2. Variables
        int[] resourceColumns = new int[catalog.resourceCount()];
        for (int i = 0; i < resourceColumns.length; i++) {
            resourceColumns[i] = program.addVariable("resource_" + i,
                    Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, resourceCoefficients[i]);
        }

        int[] recipeColumns = new int[catalog.recipeCount()];
        for (int i = 0; i < recipeColumns.length; i++) {
            recipeColumns[i] = program.addVariable("recipe_" + i,
                    0.0, Double.POSITIVE_INFINITY, recipeCoefficients[i]);
        }

        // 3. Conservation
        List<Map<Integer, Double>> resourceTerms = new ArrayList<>(catalog.resourceCount());
        for (int i = 0; i < catalog.resourceCount(); i++) {
            resourceTerms.add(new LinkedHashMap<>());
        }

        List<Recipe> recipes = catalog.getRecipes();
        for (int recipeIndex = 0; recipeIndex < recipes.size(); recipeIndex++) {
            for (RecipeRate rate : recipes.get(recipeIndex).getRates()) {
                resourceTerms.get(rate.getResource().getIndex())
                        .merge(recipeColumns[recipeIndex], rate.getRate(), Double::sum);
            }
        }

        for (int resourceIndex = 0; resourceIndex < resourceTerms.size(); resourceIndex++) {
            List<LinearProgram.Term> terms = new ArrayList<>();
            resourceTerms.get(resourceIndex).forEach((column, rate) -> terms.add(LinearProgram.Term.of(column, rate)));
            terms.add(LinearProgram.Term.of(resourceColumns[resourceIndex], -1.0));

            program.addConstraint("conservation_" + resourceIndex, terms, LinearProgram.Comparison.EQUAL, 0.0);
        }

        // 4. Non-negativity
        for (int recipeIndex = 0; recipeIndex < recipeColumns.length; recipeIndex++) {
            program.addConstraint("non_negative_" + recipeIndex,
                    List.of(LinearProgram.Term.of(recipeColumns[recipeIndex], 1.0)),
                    LinearProgram.Comparison.GREATER_OR_EQUAL, 0.0);
        }

        // 5. User rules; any rule on a resource lifts its default balance
        boolean[] balanceByDefault = new boolean[catalog.resourceCount()];
        Arrays.fill(balanceByDefault, true);

        List<Rule> rules = problem.getRules();
        for (int ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
            Rule rule = rules.get(ruleIndex);
            VariableId variable = checked(catalog, rule.getVariable());

            int column = switch (variable.getKind()) {
                case RESOURCE -> {
                    balanceByDefault[variable.getIndex()] = false;
                    yield resourceColumns[variable.getIndex()];
                }
                case RECIPE -> recipeColumns[variable.getIndex()];
            };

            Constraint constraint = rule.getConstraint();
            LinearProgram.Comparison comparison = switch (constraint.getType()) {
                case LESS -> LinearProgram.Comparison.LESS_OR_EQUAL;
                case EQUAL -> LinearProgram.Comparison.EQUAL;
                case GREATER -> LinearProgram.Comparison.GREATER_OR_EQUAL;
                case UNCONSTRAINED -> null;
            };
            if (comparison == null) {
                continue;
            }

            program.addConstraint("rule_" + ruleIndex,
                    List.of(LinearProgram.Term.of(column, 1.0)), comparison, constraint.getThreshold());
        }

        // 6. Default balance
        for (int resourceIndex = 0; resourceIndex < balanceByDefault.length; resourceIndex++) {
            if (balanceByDefault[resourceIndex]) {
                program.addConstraint("balance_" + resourceIndex,
                        List.of(LinearProgram.Term.of(resourceColumns[resourceIndex], 1.0)),
                        LinearProgram.Comparison.EQUAL, 0.0);
            }
        }

        return new Formulation(program, resourceColumns, recipeColumns);
    }

    private static VariableId checked(Catalog catalog, VariableId variable) {
        return switch (variable.getKind()) {
            case RESOURCE -> {
                catalog.resource(variable.asResource());
                yield variable;
            }
            case RECIPE -> {
                catalog.recipe(variable.asRecipe());
                yield variable;
            }
        };
    }
}

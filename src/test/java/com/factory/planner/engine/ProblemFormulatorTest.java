package com.factory.planner.engine;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Constraint;
import com.factory.planner.domain.Optimization;
import com.factory.planner.domain.Problem;
import com.factory.planner.domain.Recipe;
import com.factory.planner.domain.RecipeId;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.Resource;
import com.factory.planner.domain.ResourceId;
import com.factory.planner.domain.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("LP formulation")
class ProblemFormulatorTest {

    private final ProblemFormulator formulator = new ProblemFormulator();

    private final ResourceId ore = ResourceId.of(0);
    private final ResourceId ingot = ResourceId.of(1);
    private final RecipeId smelt = RecipeId.of(0);

    private Catalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        catalog = Catalog.build(
                List.of(Resource.named("Ore"), Resource.named("Ingot")),
                List.of(Recipe.builder().name("Smelt")
                        .rate(RecipeRate.of(ore, -30)).rate(RecipeRate.of(ingot, 30)).build()));
    }

    @Test
    @DisplayName("Resources are free columns, recipes are bounded below by zero")
    void testVariables() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder()
                .optimization(Optimization.of(ingot.variableId(), 1.0))
                .build());
        List<LinearProgram.Variable> variables = formulation.getProgram().getVariables();

        assertThat(variables).hasSize(3);
        LinearProgram.Variable oreColumn = variables.get(formulation.column(ore.variableId()));
        assertEquals(Double.NEGATIVE_INFINITY, oreColumn.getLowerBound());
        assertEquals(Double.POSITIVE_INFINITY, oreColumn.getUpperBound());
        assertEquals(0.0, oreColumn.getObjectiveCoefficient());

        assertEquals(1.0, variables.get(formulation.column(ingot.variableId())).getObjectiveCoefficient());

        LinearProgram.Variable smeltColumn = variables.get(formulation.column(smelt));
        assertEquals(0.0, smeltColumn.getLowerBound());
        assertEquals(0.0, smeltColumn.getObjectiveCoefficient());
    }

    @Test
    @DisplayName("Without rules: conservation, non-negativity, then default balance for every resource")
    void testDefaultConstraintOrder() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder().build());

        assertThat(formulation.getProgram().getConstraints())
                .extracting(LinearProgram.LinearConstraint::getName)
                .containsExactly("conservation_0", "conservation_1", "non_negative_0", "balance_0", "balance_1");

        LinearProgram.LinearConstraint conservation = formulation.getProgram().getConstraints().get(0);
        assertEquals(LinearProgram.Comparison.EQUAL, conservation.getComparison());
        assertEquals(0.0, conservation.getRhs());
        assertThat(conservation.getTerms()).containsExactly(
                LinearProgram.Term.of(formulation.column(smelt), -30.0),
                LinearProgram.Term.of(formulation.column(ore.variableId()), -1.0));
    }

    @Test
    @DisplayName("Rules become bounds in input order and lift default balance of their resource")
    void testRules() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder()
                .rule(Rule.of(ingot.variableId(), Constraint.unconstrained()))
                .rule(Rule.of(smelt.variableId(), Constraint.less(4)))
                .rule(Rule.of(ore.variableId(), Constraint.greater(-60)))
                .build());
        List<LinearProgram.LinearConstraint> constraints = formulation.getProgram().getConstraints();

        // 2 conservation + 1 non-negativity + 2 emitted rules, no balance rows left
        assertThat(constraints).extracting(LinearProgram.LinearConstraint::getName)
                .containsExactly("conservation_0", "conservation_1", "non_negative_0", "rule_1", "rule_2");

        LinearProgram.LinearConstraint recipeRule = constraints.get(3);
        assertEquals(LinearProgram.Comparison.LESS_OR_EQUAL, recipeRule.getComparison());
        assertEquals(4.0, recipeRule.getRhs());
        assertThat(recipeRule.getTerms()).containsExactly(LinearProgram.Term.of(formulation.column(smelt), 1.0));

        LinearProgram.LinearConstraint oreRule = constraints.get(4);
        assertEquals(LinearProgram.Comparison.GREATER_OR_EQUAL, oreRule.getComparison());
        assertEquals(-60.0, oreRule.getRhs());
    }

    @Test
    @DisplayName("A rule on a recipe keeps every resource balanced")
    void testRecipeRuleKeepsBalance() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder()
                .rule(Rule.of(smelt.variableId(), Constraint.equal(1)))
                .build());

        assertThat(formulation.getProgram().getConstraints())
                .extracting(LinearProgram.LinearConstraint::getName)
                .endsWith("rule_0", "balance_0", "balance_1");
    }

    @Test
    @DisplayName("Repeated rates of one recipe are merged into one coefficient")
    void testRepeatedRatesMerged() throws Exception {
        Catalog repeated = Catalog.build(List.of(Resource.named("Ore")),
                List.of(Recipe.builder().name("Mine")
                        .rate(RecipeRate.of(ore, 1)).rate(RecipeRate.of(ore, 2)).build()));

        Formulation formulation = formulator.formulate(repeated, Problem.builder().build());

        assertThat(formulation.getProgram().getConstraints().get(0).getTerms()).containsExactly(
                LinearProgram.Term.of(formulation.column(RecipeId.of(0)), 3.0),
                LinearProgram.Term.of(formulation.column(ore.variableId()), -1.0));
    }

    @Test
    @DisplayName("Later objective terms for the same variable win")
    void testObjectiveOverwrite() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder()
                .optimization(Optimization.of(smelt.variableId(), 2.0))
                .optimization(Optimization.of(smelt.variableId(), -1.0))
                .build());

        assertEquals(-1.0, formulation.getProgram().getVariables()
                .get(formulation.column(smelt)).getObjectiveCoefficient());
    }

    @Test
    @DisplayName("Resource and recipe objective terms land on their own columns")
    void testMixedObjective() {
        Formulation formulation = formulator.formulate(catalog, Problem.builder()
                .optimization(Optimization.of(ingot.variableId(), 3.0))
                .optimization(Optimization.of(smelt.variableId(), -0.5))
                .build());
        List<LinearProgram.Variable> variables = formulation.getProgram().getVariables();

        assertEquals(3.0, variables.get(formulation.column(ingot.variableId())).getObjectiveCoefficient());
        assertEquals(-0.5, variables.get(formulation.column(smelt)).getObjectiveCoefficient());
        assertEquals(0.0, variables.get(formulation.column(ore.variableId())).getObjectiveCoefficient());
    }

    @Test
    @DisplayName("Objective terms naming ids outside the catalog fail fast")
    void testForeignObjectiveIds() {
        assertThrows(IllegalArgumentException.class, () -> formulator.formulate(catalog, Problem.builder()
                .optimization(Optimization.of(RecipeId.of(4).variableId(), 1.0))
                .build()));
        assertThrows(IllegalArgumentException.class, () -> formulator.formulate(catalog, Problem.builder()
                .optimization(Optimization.of(ResourceId.of(9).variableId(), 1.0))
                .build()));
    }

    @Test
    @DisplayName("Ids outside the catalog fail fast")
    void testForeignIds() {
        Problem problem = Problem.builder()
                .rule(Rule.of(ResourceId.of(7).variableId(), Constraint.equal(0)))
                .build();

        assertThrows(IllegalArgumentException.class, () -> formulator.formulate(catalog, problem));
    }
}

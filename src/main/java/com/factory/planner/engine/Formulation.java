package com.factory.planner.engine;

import com.factory.planner.domain.RecipeId;
import com.factory.planner.domain.VariableId;

/**
 * An LP built from a catalog and problem, with the column of every catalog variable.
 */
public class Formulation {

    private final LinearProgram program;
    private final int[] resourceColumns;
    private final int[] recipeColumns;

    Formulation(LinearProgram program, int[] resourceColumns, int[] recipeColumns) {
        this.program = program;
        this.resourceColumns = resourceColumns;
        this.recipeColumns = recipeColumns;
    }

    public LinearProgram getProgram() {
        return program;
    }

    public int column(VariableId variable) {
        return switch (variable.getKind()) {
            case RESOURCE -> resourceColumns[variable.getIndex()];
            case RECIPE -> recipeColumns[variable.getIndex()];
        };
    }

    public int column(RecipeId recipe) {
        return recipeColumns[recipe.getIndex()];
    }
}

package com.factory.planner.domain;

import lombok.Value;

/**
 * Dense, zero-based index of a recipe inside one {@link Catalog}.
 */
@Value(staticConstructor = "of")
public class RecipeId {
    int index;

    public VariableId variableId() {
        return VariableId.recipe(this);
    }
}

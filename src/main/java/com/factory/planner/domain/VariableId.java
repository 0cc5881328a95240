package com.factory.planner.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A variable the optimizer reasons about: either a resource's net flow
 * or a recipe's throughput.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VariableId {

    public enum Kind {
        RESOURCE,
        RECIPE
    }

    Kind kind;
    int index;

    public static VariableId resource(ResourceId resource) {
        return new VariableId(Kind.RESOURCE, resource.getIndex());
    }

    public static VariableId recipe(RecipeId recipe) {
        return new VariableId(Kind.RECIPE, recipe.getIndex());
    }

    public ResourceId asResource() {
        if (kind != Kind.RESOURCE) {
            throw new IllegalArgumentException("Variable " + this + " is not a resource");
        }
        return ResourceId.of(index);
    }

    public RecipeId asRecipe() {
        if (kind != Kind.RECIPE) {
            throw new IllegalArgumentException("Variable " + this + " is not a recipe");
        }
        return RecipeId.of(index);
    }
}

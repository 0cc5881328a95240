package com.factory.planner.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable include/exclude mask over the recipes of a catalog. All recipes start included.
 * {@link #apply()} yields a new catalog holding only the included recipes, re-indexed;
 * resources are kept as they are.
 */
public class RecipeSelection {

    private final Catalog catalog;
    private final boolean[] included;

    public RecipeSelection(Catalog catalog) {
        this.catalog = catalog;
        this.included = new boolean[catalog.recipeCount()];
        Arrays.fill(included, true);
    }

    public RecipeSelection includeAll() {
        Arrays.fill(included, true);
        return this;
    }

    public RecipeSelection excludeAll() {
        Arrays.fill(included, false);
        return this;
    }

    public RecipeSelection includeTag(String tag) {
        return mark(tag, true);
    }

    public RecipeSelection excludeTag(String tag) {
        return mark(tag, false);
    }

    public RecipeSelection include(RecipeId recipe, boolean include) {
        catalog.recipe(recipe);
        included[recipe.getIndex()] = include;
        return this;
    }

    public boolean isIncluded(RecipeId recipe) {
        catalog.recipe(recipe);
        return included[recipe.getIndex()];
    }

    public Catalog apply() {
        List<Recipe> recipes = new ArrayList<>();
        for (int i = 0; i < included.length; i++) {
            if (included[i]) {
                recipes.add(catalog.getRecipes().get(i));
            }
        }
        try {
            return Catalog.build(catalog.getResources(), recipes);
        } catch (CatalogValidationException e) {
            // a subset of a valid catalog is valid
            throw new IllegalStateException("Filtered catalog failed validation", e);
        }
    }

    private RecipeSelection mark(String tag, boolean include) {
        List<Recipe> recipes = catalog.getRecipes();
        for (int i = 0; i < recipes.size(); i++) {
            if (recipes.get(i).hasTag(tag)) {
                included[i] = include;
            }
        }
        return this;
    }
}

package com.factory.planner.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of resources and recipes for one planning session.
 *
 * <p>Resource and recipe names are unique within a catalog, so name lookups are exact.
 * Ids handed to the lookup methods must come from this catalog; anything else is a bug
 * in the caller and fails with {@link IllegalArgumentException}.</p>
 */
public final class Catalog {

    private final List<Resource> resources;
    private final List<Recipe> recipes;
    private final Map<String, ResourceId> resourcesByName;
    private final Map<String, RecipeId> recipesByName;

    private Catalog(List<Resource> resources, List<Recipe> recipes,
                    Map<String, ResourceId> resourcesByName, Map<String, RecipeId> recipesByName) {
        this.resources = resources;
        this.recipes = recipes;
        this.resourcesByName = resourcesByName;
        this.recipesByName = recipesByName;
    }

    /**
     * Validates and builds a catalog. Every rate must point at one of {@code resources},
     * and names must be unique among resources and among recipes.
     */
    public static Catalog build(List<Resource> resources, List<Recipe> recipes) throws CatalogValidationException {
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(recipes, "recipes");

        Map<String, ResourceId> resourcesByName = new HashMap<>();
        for (int i = 0; i < resources.size(); i++) {
            String name = resources.get(i).getName();
            if (resourcesByName.putIfAbsent(name, ResourceId.of(i)) != null) {
                throw CatalogValidationException.duplicateResource(name);
            }
        }

        Map<String, RecipeId> recipesByName = new HashMap<>();
        for (int i = 0; i < recipes.size(); i++) {
            Recipe recipe = recipes.get(i);
            if (recipesByName.putIfAbsent(recipe.getName(), RecipeId.of(i)) != null) {
                throw CatalogValidationException.duplicateRecipe(recipe.getName());
            }
            for (RecipeRate rate : recipe.getRates()) {
                int index = rate.getResource().getIndex();
                if (index < 0 || index >= resources.size()) {
                    throw CatalogValidationException.unknownResource(recipe.getName(), rate.getResource());
                }
            }
        }

        return new Catalog(
                List.copyOf(resources),
                List.copyOf(recipes),
                Collections.unmodifiableMap(resourcesByName),
                Collections.unmodifiableMap(recipesByName));
    }

    public List<Resource> getResources() {
        return resources;
    }

    public List<Recipe> getRecipes() {
        return recipes;
    }

    public int resourceCount() {
        return resources.size();
    }

    public int recipeCount() {
        return recipes.size();
    }

    public List<ResourceId> resourceIds() {
        List<ResourceId> ids = new ArrayList<>(resources.size());
        for (int i = 0; i < resources.size(); i++) {
            ids.add(ResourceId.of(i));
        }
        return ids;
    }

    public List<RecipeId> recipeIds() {
        List<RecipeId> ids = new ArrayList<>(recipes.size());
        for (int i = 0; i < recipes.size(); i++) {
            ids.add(RecipeId.of(i));
        }
        return ids;
    }

    public Resource resource(ResourceId id) {
        return resources.get(checkResource(id));
    }

    public Recipe recipe(RecipeId id) {
        return recipes.get(checkRecipe(id));
    }

    public Optional<ResourceId> resourceIdOfName(String name) {
        return Optional.ofNullable(resourcesByName.get(name));
    }

    public Optional<RecipeId> recipeIdOfName(String name) {
        return Optional.ofNullable(recipesByName.get(name));
    }

    public Optional<VariableId> variableIdOfName(VariableId.Kind kind, String name) {
        return switch (kind) {
            case RESOURCE -> resourceIdOfName(name).map(ResourceId::variableId);
            case RECIPE -> recipeIdOfName(name).map(RecipeId::variableId);
        };
    }

    public String nameOfResource(ResourceId id) {
        return resource(id).getName();
    }

    public String nameOfRecipe(RecipeId id) {
        return recipe(id).getName();
    }

    /**
     * Display name of a variable, e.g. {@code "Resource Iron Ore"} or {@code "Recipe Smelt"}.
     */
    public String nameOfVariable(VariableId variable) {
        return switch (variable.getKind()) {
            case RESOURCE -> "Resource " + nameOfResource(variable.asResource());
            case RECIPE -> "Recipe " + nameOfRecipe(variable.asRecipe());
        };
    }

    /**
     * Distinct recipe tags in the order they are first seen.
     */
    public List<String> tags() {
        Set<String> tags = new LinkedHashSet<>();
        for (Recipe recipe : recipes) {
            tags.addAll(recipe.getTags());
        }
        return List.copyOf(tags);
    }

    private int checkResource(ResourceId id) {
        if (id.getIndex() < 0 || id.getIndex() >= resources.size()) {
            throw new IllegalArgumentException("Invalid resource id was used: " + id.getIndex());
        }
        return id.getIndex();
    }

    private int checkRecipe(RecipeId id) {
        if (id.getIndex() < 0 || id.getIndex() >= recipes.size()) {
            throw new IllegalArgumentException("Invalid recipe id was used: " + id.getIndex());
        }
        return id.getIndex();
    }
}

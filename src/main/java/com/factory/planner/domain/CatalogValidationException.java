package com.factory.planner.domain;

import lombok.Getter;

/**
 * Raised when a {@link Catalog} cannot be built from the supplied resources and recipes.
 *
 * <p>Rates are already resolved to ids here, so an unknown resource is reported by its
 * {@link ResourceId}. Name-level errors ("recipe X names unknown resource Y") are raised by
 * the document loader before a catalog is built.</p>
 */
@Getter
public class CatalogValidationException extends Exception {

    private final String recipeName;
    private final String resourceName;
    private final ResourceId resource;

    private CatalogValidationException(String message, String recipeName, String resourceName, ResourceId resource) {
        super(message);
        this.recipeName = recipeName;
        this.resourceName = resourceName;
        this.resource = resource;
    }

    public static CatalogValidationException unknownResource(String recipeName, ResourceId resource) {
        return new CatalogValidationException(
                "Recipe '" + recipeName + "' references unknown resource #" + resource.getIndex(),
                recipeName, null, resource);
    }

    public static CatalogValidationException duplicateResource(String resourceName) {
        return new CatalogValidationException(
                "Resource name '" + resourceName + "' is used more than once", null, resourceName, null);
    }

    public static CatalogValidationException duplicateRecipe(String recipeName) {
        return new CatalogValidationException(
                "Recipe name '" + recipeName + "' is used more than once", recipeName, null, null);
    }
}

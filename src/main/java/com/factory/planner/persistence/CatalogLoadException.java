package com.factory.planner.persistence;

import lombok.Getter;

/**
 * A catalog, rule-list or factory document could not be turned into in-memory values.
 */
@Getter
public class CatalogLoadException extends Exception {

    public enum Reason {
        MALFORMED_DOCUMENT,
        UNKNOWN_RESOURCE,
        UNKNOWN_RECIPE,
        INVALID_CATALOG
    }

    private final Reason reason;
    private final String recipeName;
    private final String resourceName;

    private CatalogLoadException(Reason reason, String message, String recipeName, String resourceName,
                                 Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.recipeName = recipeName;
        this.resourceName = resourceName;
    }

    public static CatalogLoadException malformed(String message, Throwable cause) {
        return new CatalogLoadException(Reason.MALFORMED_DOCUMENT, message, null, null, cause);
    }

    /**
     * @param recipeName recipe whose rates name the resource, or null outside a recipe
     */
    public static CatalogLoadException unknownResource(String recipeName, String resourceName) {
        String message = recipeName == null
                ? "Unknown resource '" + resourceName + "'"
                : "Recipe '" + recipeName + "' references unknown resource '" + resourceName + "'";
        return new CatalogLoadException(Reason.UNKNOWN_RESOURCE, message, recipeName, resourceName, null);
    }

    public static CatalogLoadException unknownRecipe(String recipeName) {
        return new CatalogLoadException(Reason.UNKNOWN_RECIPE, "Unknown recipe '" + recipeName + "'",
                recipeName, null, null);
    }

    public static CatalogLoadException invalidCatalog(Throwable cause) {
        return new CatalogLoadException(Reason.INVALID_CATALOG, cause.getMessage(), null, null, cause);
    }
}

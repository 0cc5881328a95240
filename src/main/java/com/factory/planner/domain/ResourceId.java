package com.factory.planner.domain;

import lombok.Value;

/**
 * Dense, zero-based index of a resource inside one {@link Catalog}.
 * Only meaningful for the catalog that produced it.
 */
@Value(staticConstructor = "of")
public class ResourceId {
    int index;

    public VariableId variableId() {
        return VariableId.resource(this);
    }
}

package com.factory.planner.domain;

import lombok.Value;

/**
 * A recipe running at {@code rate} machines (throughput units) in a {@link Factory}.
 */
@Value(staticConstructor = "of")
public class FactoryEntry {
    RecipeId recipe;
    double rate;
}

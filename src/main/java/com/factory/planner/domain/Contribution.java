package com.factory.planner.domain;

import lombok.Value;

/**
 * Share of one recipe in a resource's net flow.
 */
@Value(staticConstructor = "of")
public class Contribution {
    RecipeId recipe;
    double rate;
}

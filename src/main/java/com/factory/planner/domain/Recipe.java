package com.factory.planner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * A recipe with its rates already normalized to resource-units per unit of throughput
 * (per minute for the catalogs this planner is fed).
 */
@Value
@Builder
public class Recipe {
    String name;

    @Singular
    Set<String> tags;

    @Singular
    List<RecipeRate> rates;

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}

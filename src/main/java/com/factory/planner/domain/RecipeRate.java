package com.factory.planner.domain;

import lombok.Value;

/**
 * Signed per-unit rate of one resource in a recipe: positive is produced, negative is consumed.
 */
@Value(staticConstructor = "of")
public class RecipeRate {
    ResourceId resource;
    double rate;
}

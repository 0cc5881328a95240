package com.factory.planner.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

/**
 * Catalog as it is stored on disk: resources by name, recipes with raw rates and a
 * per-minute multiplier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogDocument {

    @Singular
    private List<String> resources;

    @Singular
    private List<RecipeDocument> recipes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecipeDocument {
        private String name;

        @Singular
        private List<String> tags;

        @JsonProperty("per_minute")
        private Double perMinute;

        @Singular
        private List<NamedRate> rates;
    }
}

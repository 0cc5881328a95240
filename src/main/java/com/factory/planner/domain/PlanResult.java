package com.factory.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Name-resolved outcome of a planning request, ready to be rendered or serialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanResult {
    private boolean feasible;
    private String status; // "Optimal", "Infeasible", "Unbounded"

    private List<RecipeRateView> recipes;         // recipe name -> machines
    private List<ResourceFlowView> netResources;  // only resources some recipe touches

    private String report;

    private long computationTimeMs;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecipeRateView {
        private String recipe;
        private double rate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceFlowView {
        private String resource;
        private double netRate;
        private List<RecipeRateView> contributions;
    }
}

package com.factory.planner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Solved production plan: recipe throughputs in catalog order, zero-rate recipes omitted.
 */
@Value
@Builder
public class Factory {
    @Singular
    List<FactoryEntry> recipes;

    /**
     * Per-resource net flow of this factory with the recipe-level breakdown.
     * Every catalog resource gets an entry, also those no recipe touches.
     */
    public NetResources netResources(Catalog catalog) {
        int resourceCount = catalog.resourceCount();
        double[] netRates = new double[resourceCount];
        List<List<Contribution>> contributions = new ArrayList<>(resourceCount);
        for (int i = 0; i < resourceCount; i++) {
            contributions.add(new ArrayList<>());
        }

        for (FactoryEntry entry : recipes) {
            for (RecipeRate resourceRate : catalog.recipe(entry.getRecipe()).getRates()) {
                int index = resourceRate.getResource().getIndex();
                double rate = entry.getRate() * resourceRate.getRate();

                netRates[index] += rate;
                contributions.get(index).add(Contribution.of(entry.getRecipe(), rate));
            }
        }

        List<ResourceFlow> flows = new ArrayList<>(resourceCount);
        for (int i = 0; i < resourceCount; i++) {
            flows.add(new ResourceFlow(ResourceId.of(i), netRates[i], List.copyOf(contributions.get(i))));
        }
        return new NetResources(List.copyOf(flows));
    }
}

package com.factory.planner.report;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Contribution;
import com.factory.planner.domain.Factory;
import com.factory.planner.domain.FactoryEntry;
import com.factory.planner.domain.NetResources;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.ResourceFlow;
import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Plain-text rendering of a factory:
 * <pre>
 * Net Resources
 * Iron Ore net -60.0 /min
 *   Smelt Iron -60.0 /min
 * Recipes
 * Smelt Iron 2.0 machines
 *   Iron Ore -60.0 /min
 * </pre>
 * Resources no recipe touches are left out.
 */
@UtilityClass
public class FactoryReportFormatter {

    public String format(Catalog catalog, Factory factory) {
        return format(catalog, factory, factory.netResources(catalog));
    }

    public String format(Catalog catalog, Factory factory, NetResources netResources) {
        StringBuilder out = new StringBuilder();
        out.append(formatNetResources(catalog, netResources));
        out.append(formatRecipes(catalog, factory));
        return out.toString();
    }

    public String formatNetResources(Catalog catalog, NetResources netResources) {
        StringBuilder out = new StringBuilder("Net Resources\n");
        for (ResourceFlow flow : netResources.getResources()) {
            if (!flow.isActive()) {
                continue;
            }
            out.append(catalog.nameOfResource(flow.getResource()))
                    .append(" net ").append(rate(flow.getNetRate())).append(" /min\n");
            for (Contribution contribution : flow.getContributions()) {
                out.append("  ").append(catalog.nameOfRecipe(contribution.getRecipe()))
                        .append(' ').append(rate(contribution.getRate())).append(" /min\n");
            }
        }
        return out.toString();
    }

    public String formatRecipes(Catalog catalog, Factory factory) {
        StringBuilder out = new StringBuilder("Recipes\n");
        for (FactoryEntry entry : factory.getRecipes()) {
            out.append(catalog.nameOfRecipe(entry.getRecipe()))
                    .append(' ').append(rate(entry.getRate())).append(" machines\n");
            for (RecipeRate resourceRate : catalog.recipe(entry.getRecipe()).getRates()) {
                out.append("  ").append(catalog.nameOfResource(resourceRate.getResource()))
                        .append(' ').append(rate(entry.getRate() * resourceRate.getRate())).append(" /min\n");
            }
        }
        return out.toString();
    }

    private String rate(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}

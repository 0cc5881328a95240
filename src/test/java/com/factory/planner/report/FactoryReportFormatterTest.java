package com.factory.planner.report;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Factory;
import com.factory.planner.domain.FactoryEntry;
import com.factory.planner.domain.Recipe;
import com.factory.planner.domain.RecipeId;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.Resource;
import com.factory.planner.domain.ResourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Factory text report")
class FactoryReportFormatterTest {

    @Test
    @DisplayName("Lists active resources with their recipes, then recipes with their resources")
    void testFormat() throws Exception {
        ResourceId ore = ResourceId.of(0);
        ResourceId ingot = ResourceId.of(1);
        Catalog catalog = Catalog.build(
                List.of(Resource.named("Iron Ore"), Resource.named("Iron Ingot"), Resource.named("Coal")),
                List.of(Recipe.builder().name("Smelt Iron")
                        .rate(RecipeRate.of(ore, -30)).rate(RecipeRate.of(ingot, 30)).build()));
        Factory factory = Factory.builder().recipe(FactoryEntry.of(RecipeId.of(0), 2.0)).build();

        String report = FactoryReportFormatter.format(catalog, factory);

        assertEquals(String.join("\n",
                "Net Resources",
                "Iron Ore net -60.0 /min",
                "  Smelt Iron -60.0 /min",
                "Iron Ingot net 60.0 /min",
                "  Smelt Iron 60.0 /min",
                "Recipes",
                "Smelt Iron 2.0 machines",
                "  Iron Ore -60.0 /min",
                "  Iron Ingot 60.0 /min",
                ""), report);
    }

    @Test
    @DisplayName("An empty factory renders only the headings")
    void testEmpty() throws Exception {
        Catalog catalog = Catalog.build(List.of(Resource.named("Coal")), List.of());

        assertEquals("Net Resources\nRecipes\n", FactoryReportFormatter.format(catalog, Factory.builder().build()));
    }
}

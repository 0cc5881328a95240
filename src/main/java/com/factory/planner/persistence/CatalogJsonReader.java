package com.factory.planner.persistence;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.CatalogValidationException;
import com.factory.planner.domain.Recipe;
import com.factory.planner.domain.RecipeRate;
import com.factory.planner.domain.Resource;
import com.factory.planner.domain.ResourceId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads catalog documents of the form
 * <pre>
 * {"resources": ["Iron Ore", "Iron Ingot"],
 *  "recipes": [{"name": "Smelt Iron", "tags": ["smelter"], "per_minute": 30.0,
 *               "rates": [["Iron Ore", -1.0], ["Iron Ingot", 1.0]]}]}
 * </pre>
 * Raw rates are multiplied by {@code per_minute} before they reach the catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogJsonReader {

    private final ObjectMapper objectMapper;

    public Catalog read(Reader reader) throws CatalogLoadException {
        CatalogDocument document;
        try {
            document = objectMapper.readValue(reader, CatalogDocument.class);
        } catch (JsonProcessingException e) {
            throw CatalogLoadException.malformed("Catalog document is not valid: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw CatalogLoadException.malformed("Could not read catalog document", e);
        }
        return fromDocument(document);
    }

    public Catalog fromDocument(CatalogDocument document) throws CatalogLoadException {
        if (document == null || document.getResources() == null || document.getRecipes() == null) {
            throw CatalogLoadException.malformed("Catalog document needs 'resources' and 'recipes'", null);
        }

        List<Resource> resources = new ArrayList<>();
        Map<String, ResourceId> resourceIds = new HashMap<>();
        for (String name : document.getResources()) {
            resourceIds.putIfAbsent(name, ResourceId.of(resources.size()));
            resources.add(Resource.named(name));
        }

        List<Recipe> recipes = new ArrayList<>();
        for (CatalogDocument.RecipeDocument recipeDocument : document.getRecipes()) {
            String recipeName = recipeDocument.getName();
            if (recipeName == null || recipeDocument.getPerMinute() == null) {
                throw CatalogLoadException.malformed("Recipe entries need 'name' and 'per_minute'", null);
            }
            double perMinute = recipeDocument.getPerMinute();

            Recipe.RecipeBuilder recipe = Recipe.builder().name(recipeName);
            if (recipeDocument.getTags() != null) {
                recipe.tags(recipeDocument.getTags());
            }
            if (recipeDocument.getRates() != null) {
                for (NamedRate rate : recipeDocument.getRates()) {
                    ResourceId resource = resourceIds.get(rate.getName());
                    if (resource == null) {
                        throw CatalogLoadException.unknownResource(recipeName, rate.getName());
                    }
                    recipe.rate(RecipeRate.of(resource, rate.getRate() * perMinute));
                }
            }
            recipes.add(recipe.build());
        }

        try {
            Catalog catalog = Catalog.build(resources, recipes);
            log.debug("Loaded catalog with {} resources and {} recipes", catalog.resourceCount(), catalog.recipeCount());
            return catalog;
        } catch (CatalogValidationException e) {
            throw CatalogLoadException.invalidCatalog(e);
        }
    }
}

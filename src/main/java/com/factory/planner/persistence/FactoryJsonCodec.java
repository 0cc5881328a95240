package com.factory.planner.persistence;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Factory;
import com.factory.planner.domain.FactoryEntry;
import com.factory.planner.domain.RecipeId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Reads and writes factory documents: {@code {"recipes": [["Smelt Iron", 2.0], ...]}}.
 * Rates are stored exactly as solved, no re-rounding happens here.
 */
@Component
@RequiredArgsConstructor
public class FactoryJsonCodec {

    private final ObjectMapper objectMapper;

    public Factory read(Reader reader, Catalog catalog) throws CatalogLoadException {
        FactoryDocument document;
        try {
            document = objectMapper.readValue(reader, FactoryDocument.class);
        } catch (JsonProcessingException e) {
            throw CatalogLoadException.malformed("Factory document is not valid: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw CatalogLoadException.malformed("Could not read factory document", e);
        }
        return fromDocument(document, catalog);
    }

    public void write(Factory factory, Catalog catalog, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toDocument(factory, catalog));
    }

    public Factory fromDocument(FactoryDocument document, Catalog catalog) throws CatalogLoadException {
        Factory.FactoryBuilder factory = Factory.builder();
        if (document == null || document.getRecipes() == null) {
            return factory.build();
        }
        for (NamedRate entry : document.getRecipes()) {
            RecipeId recipe = catalog.recipeIdOfName(entry.getName())
                    .orElseThrow(() -> CatalogLoadException.unknownRecipe(entry.getName()));
            factory.recipe(FactoryEntry.of(recipe, entry.getRate()));
        }
        return factory.build();
    }

    public FactoryDocument toDocument(Factory factory, Catalog catalog) {
        FactoryDocument document = new FactoryDocument();
        for (FactoryEntry entry : factory.getRecipes()) {
            document.getRecipes().add(new NamedRate(catalog.nameOfRecipe(entry.getRecipe()), entry.getRate()));
        }
        return document;
    }
}

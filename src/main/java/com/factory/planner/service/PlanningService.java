package com.factory.planner.service;

import com.factory.planner.domain.Catalog;
import com.factory.planner.domain.Factory;
import com.factory.planner.domain.NetResources;
import com.factory.planner.domain.Optimization;
import com.factory.planner.domain.PlanResult;
import com.factory.planner.domain.Problem;
import com.factory.planner.domain.RecipeSelection;
import com.factory.planner.domain.ResourceFlow;
import com.factory.planner.domain.RuleList;
import com.factory.planner.domain.VariableId;
import com.factory.planner.engine.ProductionPlanner;
import com.factory.planner.engine.SolveException;
import com.factory.planner.persistence.CatalogDocument;
import com.factory.planner.persistence.CatalogJsonReader;
import com.factory.planner.persistence.CatalogLoadException;
import com.factory.planner.persistence.OptimizationDocument;
import com.factory.planner.persistence.RuleListJsonCodec;
import com.factory.planner.report.FactoryReportFormatter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanningService {

    private final ProductionPlanner planner;
    private final CatalogJsonReader catalogReader;
    private final RuleListJsonCodec ruleListCodec;

    /**
     * Resolves a name-based request against its catalog document and plans it.
     */
    public PlanResult plan(CatalogDocument catalogDocument, JsonNode rules,
                           List<OptimizationDocument> optimizations, List<String> excludedTags)
            throws CatalogLoadException {
        // Basic Validation
        if (catalogDocument == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }

        Catalog catalog = catalogReader.fromDocument(catalogDocument);
        if (excludedTags != null && !excludedTags.isEmpty()) {
            RecipeSelection selection = new RecipeSelection(catalog);
            excludedTags.forEach(selection::excludeTag);
            catalog = selection.apply();
            log.debug("Excluded tags {} leave {} recipes", excludedTags, catalog.recipeCount());
        }

        RuleList ruleList = ruleListCodec.fromTree(rules, catalog);

        List<Optimization> objective = new ArrayList<>();
        if (optimizations != null) {
            for (OptimizationDocument optimization : optimizations) {
                objective.add(Optimization.of(resolve(catalog, optimization), optimization.getCoefficient()));
            }
        }

        return plan(catalog, Problem.of(ruleList, objective));
    }

    public PlanResult plan(Catalog catalog, Problem problem) {
        long startTime = System.currentTimeMillis();

        Factory factory;
        try {
            factory = planner.solve(catalog, problem);
        } catch (SolveException e) {
            log.warn("Planning failed: {}", e.getMessage());
            return PlanResult.builder()
                    .feasible(false)
                    .status(e.getMessage())
                    .recipes(List.of())
                    .netResources(List.of())
                    .computationTimeMs(System.currentTimeMillis() - startTime)
                    .build();
        }

        NetResources netResources = factory.netResources(catalog);

        List<PlanResult.RecipeRateView> recipes = factory.getRecipes().stream()
                .map(entry -> new PlanResult.RecipeRateView(catalog.nameOfRecipe(entry.getRecipe()), entry.getRate()))
                .collect(Collectors.toList());

        List<PlanResult.ResourceFlowView> flows = new ArrayList<>();
        for (ResourceFlow flow : netResources.getResources()) {
            if (!flow.isActive()) {
                continue;
            }
            List<PlanResult.RecipeRateView> contributions = flow.getContributions().stream()
                    .map(c -> new PlanResult.RecipeRateView(catalog.nameOfRecipe(c.getRecipe()), c.getRate()))
                    .collect(Collectors.toList());
            flows.add(new PlanResult.ResourceFlowView(
                    catalog.nameOfResource(flow.getResource()), flow.getNetRate(), contributions));
        }

        return PlanResult.builder()
                .feasible(true)
                .status("Optimal")
                .recipes(recipes)
                .netResources(flows)
                .report(FactoryReportFormatter.format(catalog, factory, netResources))
                .computationTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private static VariableId resolve(Catalog catalog, OptimizationDocument optimization) throws CatalogLoadException {
        String name = optimization.getName();
        if ("Resource".equalsIgnoreCase(optimization.getKind())) {
            return catalog.variableIdOfName(VariableId.Kind.RESOURCE, name)
                    .orElseThrow(() -> CatalogLoadException.unknownResource(null, name));
        }
        if ("Recipe".equalsIgnoreCase(optimization.getKind())) {
            return catalog.variableIdOfName(VariableId.Kind.RECIPE, name)
                    .orElseThrow(() -> CatalogLoadException.unknownRecipe(name));
        }
        throw new IllegalArgumentException("Optimization kind must be Resource or Recipe, got " + optimization.getKind());
    }
}
